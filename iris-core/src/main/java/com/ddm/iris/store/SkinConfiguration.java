package com.ddm.iris.store;

import com.ddm.iris.defined.Colour4;
import jakarta.annotation.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 单个配置源持有的配置存储。
 *
 * <p>存储内容：
 * <ul>
 *   <li><strong>settings</strong>：自由文本名称 → 字符串值；值可以是显式的 null，
 *       与"键不存在"是两种不同状态</li>
 *   <li><strong>customColours</strong>：名称 → {@link Colour4}</li>
 *   <li><strong>comboColours</strong>：有序 combo 调色板，可以为空</li>
 *   <li><strong>allowDefaultComboColoursFallback</strong>：是否允许回退到默认调色板，默认 true</li>
 *   <li><strong>legacyVersion</strong>：皮肤版本号；null 表示交给下一个配置源或最终默认值</li>
 * </ul>
 *
 * <p><strong>并发：</strong>
 * 每个条目的写入都是原子替换（ConcurrentHashMap / volatile 字段 / 整体替换的不可变列表），
 * 并发的查找只会看到写入前或写入后的值；不提供跨条目的原子性。
 *
 * @author liyifei
 * @since 1.0
 */
public final class SkinConfiguration {

    /**
     * 内置的默认 combo 调色板。
     */
    public static final List<Colour4> DEFAULT_COMBO_COLOURS = List.of(
            new Colour4(255, 192, 0),
            new Colour4(0, 202, 0),
            new Colour4(18, 124, 255),
            new Colour4(242, 24, 57)
    );

    /**
     * 所有配置源都未指定版本时使用的最新版本。
     */
    public static final BigDecimal LATEST_VERSION = new BigDecimal("2.7");

    /**
     * skin.ini 中没有 Version 行时的基线版本。
     */
    public static final BigDecimal BASELINE_VERSION = new BigDecimal("1.0");

    /**
     * ConcurrentHashMap 不能存放 null，显式的 null 值用 SettingValue 包装。
     */
    private final Map<String, SettingValue> settings = new ConcurrentHashMap<>();
    private final Map<String, Colour4> customColours = new ConcurrentHashMap<>();

    private volatile List<Colour4> comboColours = List.of();
    private volatile boolean allowDefaultComboColoursFallback = true;
    @Nullable
    private volatile BigDecimal legacyVersion;

    // ===== settings =====

    /**
     * 写入配置项，{@code value} 为 null 表示"键存在但没有值"。
     */
    public void setSetting(String name, @Nullable String value) {
        settings.put(Objects.requireNonNull(name, "name"), new SettingValue(value));
    }

    public void removeSetting(String name) {
        settings.remove(name);
    }

    /**
     * 查找配置项。
     *
     * @return 配置项；键不存在时返回 null（与值为 null 的 SettingValue 区分）
     */
    @Nullable
    public SettingValue findSetting(String name) {
        return settings.get(name);
    }

    public boolean hasSetting(String name) {
        return settings.containsKey(name);
    }

    public Set<String> settingNames() {
        return Collections.unmodifiableSet(settings.keySet());
    }

    // ===== custom colours =====

    public void setCustomColour(String name, Colour4 colour) {
        customColours.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(colour, "colour"));
    }

    public void removeCustomColour(String name) {
        customColours.remove(name);
    }

    @Nullable
    public Colour4 findCustomColour(String name) {
        return customColours.get(name);
    }

    public Map<String, Colour4> customColours() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(customColours));
    }

    // ===== combo colours =====

    /**
     * 当前 combo 调色板（不可变快照）。
     */
    public List<Colour4> getComboColours() {
        return comboColours;
    }

    public void setComboColours(List<Colour4> colours) {
        this.comboColours = List.copyOf(colours);
    }

    public synchronized void addComboColours(Colour4... colours) {
        List<Colour4> merged = new ArrayList<>(comboColours);
        merged.addAll(Arrays.asList(colours));
        this.comboColours = List.copyOf(merged);
    }

    public void clearComboColours() {
        this.comboColours = List.of();
    }

    public boolean isAllowDefaultComboColoursFallback() {
        return allowDefaultComboColoursFallback;
    }

    public void setAllowDefaultComboColoursFallback(boolean allow) {
        this.allowDefaultComboColoursFallback = allow;
    }

    // ===== legacy version =====

    @Nullable
    public BigDecimal getLegacyVersion() {
        return legacyVersion;
    }

    public void setLegacyVersion(@Nullable BigDecimal legacyVersion) {
        this.legacyVersion = legacyVersion;
    }

    @Override
    public String toString() {
        return "SkinConfiguration{settings=" + settings.size()
                + ", customColours=" + customColours.size()
                + ", comboColours=" + comboColours.size()
                + ", allowDefaultComboColoursFallback=" + allowDefaultComboColoursFallback
                + ", legacyVersion=" + legacyVersion + "}";
    }

    /**
     * 配置项的值，{@code raw} 可以为 null。
     */
    public record SettingValue(@Nullable String raw) {
    }
}
