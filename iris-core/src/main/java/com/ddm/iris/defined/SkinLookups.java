package com.ddm.iris.defined;

import com.ddm.iris.utils.TypeRef;
import jakarta.annotation.Nullable;

import java.lang.reflect.Type;
import java.math.BigDecimal;
import java.util.List;

/**
 * 查找键的工厂方法集合，返回带有静态值类型的查找键。
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * Bindable<Float> scale = skin.getConfig(SkinLookups.setting("CursorScale", Float.class));
 * Bindable<Colour4> border = skin.getConfig(SkinLookups.customColour("SliderBorder"));
 * Bindable<List<Colour4>> combo = skin.getConfig(SkinLookups.comboColours());
 * Bindable<BigDecimal> version = skin.getConfig(SkinLookups.legacyVersion());
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public final class SkinLookups {

    /**
     * combo 调色板的槽位类型。
     */
    public static final Type COMBO_COLOURS_TYPE = new TypeRef<List<Colour4>>() {
    }.getType();

    private SkinLookups() {
    }

    public static SettingLookup<String> setting(String name) {
        return new SettingLookup<>(name, String.class);
    }

    public static <T> SettingLookup<T> setting(String name, Class<T> type) {
        return new SettingLookup<>(name, type);
    }

    public static <T> SettingLookup<T> setting(String name, TypeRef<T> type) {
        return new SettingLookup<>(name, type.getType());
    }

    public static <T> EnumSettingLookup<T> setting(Enum<?> key, Class<T> type) {
        return new EnumSettingLookup<>(key, type);
    }

    public static CustomColourLookup<Colour4> customColour(String name) {
        return new CustomColourLookup<>(name, Colour4.class);
    }

    /**
     * 以任意目标类型查找命名颜色。目标类型无法容纳 {@link Colour4} 时，
     * 解析阶段会抛出 {@link com.ddm.iris.LookupContractException}。
     */
    public static <T> CustomColourLookup<T> customColour(String name, Class<T> type) {
        return new CustomColourLookup<>(name, type);
    }

    public static GlobalColourLookup<List<Colour4>> comboColours() {
        return new GlobalColourLookup<>(GlobalSkinColour.COMBO_COLOURS, COMBO_COLOURS_TYPE);
    }

    public static GlobalColourLookup<Colour4> globalColour(GlobalSkinColour colour) {
        return new GlobalColourLookup<>(colour, Colour4.class);
    }

    public static <T> GlobalColourLookup<T> globalColour(GlobalSkinColour colour, Type type) {
        return new GlobalColourLookup<>(colour, type);
    }

    public static LegacySettingLookup<BigDecimal> legacyVersion() {
        return new LegacySettingLookup<>(LegacySetting.VERSION, BigDecimal.class);
    }

    public static <T> LegacySettingLookup<T> legacySetting(LegacySetting setting, Class<T> type) {
        return new LegacySettingLookup<>(setting, type);
    }

    /**
     * 查找键对应的结构化存储槽位类型。
     *
     * @return 槽位类型；以字符串存储的查找键（自由文本/枚举）返回 null
     */
    @Nullable
    public static Type slotType(SkinLookup<?> lookup) {
        if (lookup instanceof CustomColourLookup<?>) return Colour4.class;
        if (lookup instanceof GlobalColourLookup<?> g) {
            return g.colour() == GlobalSkinColour.COMBO_COLOURS ? COMBO_COLOURS_TYPE : Colour4.class;
        }
        if (lookup instanceof LegacySettingLookup<?>) return BigDecimal.class;
        return null;
    }
}
