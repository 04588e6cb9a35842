package com.ddm.iris.defined;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * 命名颜色查找，存储槽位类型固定为 {@link Colour4}。
 *
 * @author liyifei
 * @param name      颜色名称，如 {@code SliderBorder}
 * @param valueType 目标类型，必须能容纳 {@link Colour4}
 * @param <T>       目标类型
 * @since 1.0
 */
public record CustomColourLookup<T>(String name, Type valueType) implements SkinLookup<T> {
    public CustomColourLookup {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public String toString() {
        return "colour '" + name + "' <" + valueType.getTypeName() + ">";
    }
}
