package com.ddm.iris.store;

import com.ddm.iris.defined.Colour4;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * skin.ini 解码器，把文本格式的皮肤定义读入 {@link SkinConfiguration}。
 *
 * <p><strong>格式：</strong>
 * <pre>
 * [General]
 * Name: My Skin
 * Version: 2.5          // 或 latest
 * AllowSliderBallTint: 1
 *
 * [Colours]
 * Combo1: 255,192,0
 * Combo2: 0,202,0
 * SliderBorder: 255,255,255
 * </pre>
 *
 * <ul>
 *   <li>[General] 的 Version 写入 legacyVersion；值为空时保持 null（交给下一个配置源）</li>
 *   <li>整个文件没有 Version 行时，legacyVersion 为 {@link SkinConfiguration#BASELINE_VERSION}</li>
 *   <li>[Colours] 中 ComboN 按 N 排序写入调色板，其余写入自定义颜色</li>
 *   <li>其他所有键值对写入 settings（不区分段落）</li>
 *   <li>空行与 {@code //} 注释忽略；无法解析的颜色/版本记录告警后跳过</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public class LegacySkinDecoder {

    private static final Logger log = LoggerFactory.getLogger(LegacySkinDecoder.class);

    private static final String SECTION_GENERAL = "General";
    private static final String SECTION_COLOURS = "Colours";
    private static final String KEY_VERSION = "Version";
    private static final String VERSION_LATEST = "latest";
    private static final Pattern COMBO_KEY = Pattern.compile("^Combo(\\d{1,3})$");

    public SkinConfiguration decode(Path file) {
        // 非法字节替换为 U+FFFD，不中断解码
        try (Reader reader = new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8)) {
            log.debug("Decoding skin definition from {}", file);
            return decode(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read skin definition " + file, e);
        }
    }

    public SkinConfiguration decode(String content) {
        return decode(new StringReader(content));
    }

    /**
     * 解码 skin.ini 内容。调用方负责关闭 reader。
     *
     * @throws UncheckedIOException 读取失败时抛出
     */
    public SkinConfiguration decode(Reader reader) {
        SkinConfiguration config = new SkinConfiguration();
        Map<Integer, Colour4> combos = new TreeMap<>();
        boolean versionSeen = false;
        String section = SECTION_GENERAL;

        BufferedReader lines = reader instanceof BufferedReader br ? br : new BufferedReader(reader);
        try {
            String line;
            int lineNo = 0;
            while ((line = lines.readLine()) != null) {
                lineNo++;
                if (lineNo == 1 && line.startsWith("\uFEFF")) line = line.substring(1);

                line = stripComment(line).trim();
                if (line.isEmpty()) continue;

                if (line.startsWith("[") && line.endsWith("]")) {
                    section = line.substring(1, line.length() - 1).trim();
                    continue;
                }

                int idx = line.indexOf(':');
                if (idx <= 0) {
                    log.debug("Skipping malformed line {}: '{}'", lineNo, line);
                    continue;
                }
                String key = line.substring(0, idx).trim();
                String value = line.substring(idx + 1).trim();

                if (SECTION_COLOURS.equalsIgnoreCase(section)) {
                    readColour(config, combos, key, value, lineNo);
                } else if (SECTION_GENERAL.equalsIgnoreCase(section) && KEY_VERSION.equals(key)) {
                    versionSeen = true;
                    config.setLegacyVersion(parseVersion(value, lineNo));
                } else {
                    config.setSetting(key, value);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read skin definition", e);
        }

        if (!combos.isEmpty()) {
            config.setComboColours(combos.values().stream().toList());
        }
        if (!versionSeen) {
            config.setLegacyVersion(SkinConfiguration.BASELINE_VERSION);
        }
        log.trace("Decoded {}", config);
        return config;
    }

    private static void readColour(SkinConfiguration config, Map<Integer, Colour4> combos,
                                   String key, String value, int lineNo) {
        Colour4 colour = Colour4.parse(value);
        if (colour == null) {
            log.warn("Ignoring invalid colour '{}' for {} at line {}", value, key, lineNo);
            return;
        }
        Matcher m = COMBO_KEY.matcher(key);
        if (m.matches()) {
            combos.put(Integer.parseInt(m.group(1)), colour);
        } else {
            config.setCustomColour(key, colour);
        }
    }

    @Nullable
    private static BigDecimal parseVersion(String value, int lineNo) {
        if (value.isEmpty()) return null;
        if (VERSION_LATEST.equalsIgnoreCase(value)) return SkinConfiguration.LATEST_VERSION;
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid skin version '{}' at line {}", value, lineNo);
            return null;
        }
    }

    private static String stripComment(String line) {
        int idx = line.indexOf("//");
        return idx < 0 ? line : line.substring(0, idx);
    }
}
