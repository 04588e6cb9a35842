package com.ddm.iris.defined;

import java.lang.reflect.Type;

/**
 * 皮肤配置查找键。
 * <p>
 * 查找键是一个封闭的变体集合，每个变体都携带调用方期望的值类型：
 * <ul>
 *   <li>{@link SettingLookup}：自由文本名称，对应字符串配置项</li>
 *   <li>{@link EnumSettingLookup}：枚举常量，以常量名查找字符串配置项</li>
 *   <li>{@link CustomColourLookup}：命名颜色</li>
 *   <li>{@link GlobalColourLookup}：全局颜色类别（如 combo 调色板）</li>
 *   <li>{@link LegacySettingLookup}：结构化的 legacy 设置（如版本号）</li>
 * </ul>
 * 所有变体均为 record，可直接作为 Map 的键使用。
 *
 * @author liyifei
 * @param <T> 期望的值类型
 * @see SkinLookups
 * @since 1.0
 */
public sealed interface SkinLookup<T>
        permits SettingLookup, EnumSettingLookup, CustomColourLookup, GlobalColourLookup, LegacySettingLookup {

    /**
     * 调用方期望的值类型，可能是参数化类型（如 {@code List<Colour4>}）。
     */
    Type valueType();
}
