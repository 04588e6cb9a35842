package com.ddm.iris.defined;

/**
 * 全局颜色类别。
 * <p>
 * 除 {@link #COMBO_COLOURS} 外，其余类别都映射到自定义颜色表中的一个固定名称。
 *
 * @author liyifei
 */
public enum GlobalSkinColour {
    COMBO_COLOURS("ComboColours"),
    MENU_GLOW("MenuGlow"),
    STAR_BREAK_ADDITIVE("StarBreakAdditive");

    private final String skinKey;

    GlobalSkinColour(String skinKey) {
        this.skinKey = skinKey;
    }

    /**
     * skin.ini 中 [Colours] 段使用的名称。
     */
    public String skinKey() {
        return skinKey;
    }
}
