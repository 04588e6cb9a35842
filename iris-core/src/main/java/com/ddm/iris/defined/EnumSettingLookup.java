package com.ddm.iris.defined;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * 以枚举常量作为键的配置查找，配置名称取常量的 {@link Enum#name()}。
 *
 * @author liyifei
 * @param key       枚举常量
 * @param valueType 目标类型
 * @param <T>       目标类型
 * @since 1.0
 */
public record EnumSettingLookup<T>(Enum<?> key, Type valueType) implements SkinLookup<T> {
    public EnumSettingLookup {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(valueType, "valueType");
    }

    /**
     * 在配置字典中使用的名称。
     */
    public String name() {
        return key.name();
    }

    @Override
    public String toString() {
        return "setting " + key.getDeclaringClass().getSimpleName() + "." + key.name()
                + " <" + valueType.getTypeName() + ">";
    }
}
