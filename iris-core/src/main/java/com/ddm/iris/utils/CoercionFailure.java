package com.ddm.iris.utils;

import jakarta.annotation.Nullable;

import java.lang.reflect.Type;

/**
 * 原始值存在但无法转换为目标类型（NotConvertible）。
 * <p>
 * 该失败只在本地被消化：配置源被视为"没有可用值"，解析链继续向下查找。
 *
 * @author liyifei
 * @param raw    原始字符串，可能为 null
 * @param target 目标类型
 * @param reason 失败原因
 * @since 1.0
 */
public record CoercionFailure(@Nullable String raw, Type target, String reason) {

    public static CoercionFailure notConvertible(@Nullable String raw, Type target, String reason) {
        return new CoercionFailure(raw, target, reason);
    }

    @Override
    public String toString() {
        return "NotConvertible[raw=" + (raw == null ? "null" : "'" + raw + "'")
                + " -> " + target.getTypeName() + ": " + reason + "]";
    }
}
