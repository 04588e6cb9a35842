package com.ddm.iris.defined;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * 按自由文本名称查找字符串配置项，并转换为 {@code valueType}。
 *
 * @author liyifei
 * @param name      配置名称，区分大小写
 * @param valueType 目标类型
 * @param <T>       目标类型
 * @since 1.0
 */
public record SettingLookup<T>(String name, Type valueType) implements SkinLookup<T> {
    public SettingLookup {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public String toString() {
        return "setting '" + name + "' <" + valueType.getTypeName() + ">";
    }
}
