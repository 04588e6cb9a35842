package com.ddm.iris.defined;

import java.lang.reflect.Type;
import java.util.Objects;

/**
 * 结构化 legacy 设置查找。
 *
 * @author liyifei
 * @param setting   设置项
 * @param valueType 目标类型
 * @param <T>       目标类型
 * @since 1.0
 */
public record LegacySettingLookup<T>(LegacySetting setting, Type valueType) implements SkinLookup<T> {
    public LegacySettingLookup {
        Objects.requireNonNull(setting, "setting");
        Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public String toString() {
        return "legacy setting " + setting + " <" + valueType.getTypeName() + ">";
    }
}
