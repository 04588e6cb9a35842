package com.ddm.iris.defined;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * 全局颜色类别查找。
 * <p>
 * {@link GlobalSkinColour#COMBO_COLOURS} 的槽位类型为 {@code List<Colour4>}，
 * 其余类别的槽位类型为 {@link Colour4}。
 *
 * @author liyifei
 * @param colour    全局颜色类别
 * @param valueType 目标类型
 * @param <T>       目标类型
 * @since 1.0
 */
public record GlobalColourLookup<T>(GlobalSkinColour colour, Type valueType) implements SkinLookup<T> {
    public GlobalColourLookup {
        Objects.requireNonNull(colour, "colour");
        Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public String toString() {
        return "global colour " + colour + " <" + valueType.getTypeName() + ">";
    }
}
