package com.ddm.iris.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

/**
 * 皮肤配置主绑定类，对应属性前缀：{@code iris.skin.*}
 *
 * <p><strong>示例 YAML 配置：</strong>
 * <pre>{@code
 * iris:
 *   skin:
 *     ttl: 30S
 *     sources:
 *       - name: beatmap
 *         settings:
 *           CursorScale: "1.2"
 *         allow-default-combo-colours-fallback: false
 *       - name: user
 *         ini: /opt/skins/default/skin.ini
 *         assets: /opt/skins/default
 * }</pre>
 *
 * <p>{@code sources} 的顺序即解析链的顺序，最具体的配置源写在最前面。
 *
 * @see DefaultSkinSourceRegistry
 * @since 1.0
 */
@ConfigurationProperties(prefix = "iris.skin")
/**
 * {@link IrisProperties} 类的单元测试。
 *
 * @author liyifei
 */
public record IrisProperties(

        /**
         * 配置源缓存 TTL，单位秒。
         * <p>
         * 超过 TTL 后首次访问时异步重新加载配置源（重新读取 skin.ini），刷新期间返回旧值。
         * 不配置时默认 30 秒；为 0 时不自动刷新。
         */
        @DurationUnit(ChronoUnit.SECONDS)
        Duration ttl,

        /**
         * 配置源定义，按优先级从高到低排列。
         */
        List<Source> sources

) {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);

    public IrisProperties {
        if (ttl == null) ttl = DEFAULT_TTL;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    /**
     * 单个配置源定义。ini 中的内容先加载，内联配置覆盖其上。
     *
     * @param name                             配置源名称，必须唯一
     * @param ini                              skin.ini 路径，可选
     * @param assets                           资源目录，可选
     * @param settings                         内联配置项
     * @param colours                          内联自定义颜色，值为 {@code r,g,b[,a]}
     * @param comboColours                     内联 combo 调色板，非空时替换 ini 中的调色板
     * @param allowDefaultComboColoursFallback 是否允许回退到默认调色板，不配置时保持 ini 的结果（默认 true）
     * @param version                          皮肤版本，不配置时保持 ini 的结果
     */
    public record Source(
            String name,
            String ini,
            String assets,
            Map<String, String> settings,
            Map<String, String> colours,
            List<String> comboColours,
            Boolean allowDefaultComboColoursFallback,
            BigDecimal version
    ) {
    }
}
