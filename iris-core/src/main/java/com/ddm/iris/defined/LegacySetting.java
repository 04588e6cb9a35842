package com.ddm.iris.defined;

/**
 * 由存储结构化字段承载的 legacy 设置。
 *
 * @author liyifei
 */
public enum LegacySetting {
    /**
     * 皮肤格式版本，槽位类型为 {@link java.math.BigDecimal}。
     */
    VERSION
}
