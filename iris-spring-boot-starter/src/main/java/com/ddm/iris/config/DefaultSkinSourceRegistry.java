package com.ddm.iris.config;

import com.ddm.iris.chain.ResolutionChain;
import com.ddm.iris.defined.Colour4;
import com.ddm.iris.source.SkinSource;
import com.ddm.iris.store.LegacySkinDecoder;
import com.ddm.iris.store.SkinConfiguration;
import com.github.benmanes.caffeine.cache.CacheLoader;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 默认的配置源注册表，基于 Caffeine LoadingCache + 异步刷新。
 *
 * <p><strong>缓存机制：</strong>
 * <ul>
 *   <li>配置源按名称缓存，加载时解码 skin.ini 并叠加内联配置</li>
 *   <li>采用 refreshAfterWrite 策略，超过 TTL 后异步重新加载，读取时返回旧配置源</li>
 *   <li>重新加载失败时 Caffeine 保留旧配置源</li>
 *   <li>首次加载失败时缓存 MISSING_SOURCE（负缓存），不参与解析链，
 *       直到 TTL 刷新或 {@link #refresh()} 后重新尝试</li>
 * </ul>
 *
 * <p>解析链不缓存：{@link #currentChain()} 每次按定义顺序从缓存中取出配置源重新组装，
 * 配置源被刷新后，新的解析链在下一次调用时生效。
 *
 * @author liyifei
 * @see IrisProperties
 * @since 1.0
 */
public final class DefaultSkinSourceRegistry implements SkinSourceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultSkinSourceRegistry.class);

    /**
     * 负缓存标记：配置源加载失败，避免每次查找都重新读取 skin.ini。
     */
    private static final SkinSource MISSING_SOURCE = new SkinSource("", new SkinConfiguration());

    private static final int REFRESH_POOL_SIZE = 2;

    private final ExecutorService refreshPool;

    private final LoadingCache<String, SkinSource> cache;

    /**
     * 配置源定义，保持配置文件中的顺序。
     */
    private final Map<String, IrisProperties.Source> definitions;

    private final LegacySkinDecoder decoder;

    public DefaultSkinSourceRegistry(IrisProperties props) {
        this(props, new LegacySkinDecoder());
    }

    /**
     * @param props   配置属性
     * @param decoder skin.ini 解码器
     * @throws IllegalArgumentException 配置源名称为空或重复
     */
    public DefaultSkinSourceRegistry(IrisProperties props, LegacySkinDecoder decoder) {
        Objects.requireNonNull(props, "props");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.definitions = indexDefinitions(props.sources());
        this.refreshPool = createRefreshExecutor();

        Caffeine<Object, Object> builder = Caffeine.newBuilder().executor(refreshPool);
        Duration ttl = props.ttl();
        if (!ttl.isZero() && !ttl.isNegative()) {
            builder.refreshAfterWrite(ttl);
        }
        this.cache = builder.build(new CacheLoader<String, SkinSource>() {
            @Override
            public SkinSource load(String name) {
                try {
                    return loadSource(name);
                } catch (IllegalStateException e) {
                    log.error("Skin source '{}' unavailable, caching MISSING_SOURCE", name, e);
                    return MISSING_SOURCE;
                }
            }

            @Override
            public SkinSource reload(String name, SkinSource oldValue) {
                try {
                    return loadSource(name);
                } catch (IllegalStateException e) {
                    log.error("Failed to reload skin source '{}', keeping old value", name, e);
                    throw e;
                }
            }
        });

        log.info("Skin source registry initialized with sources {} (ttl={})", definitions.keySet(), ttl);
    }

    @Override
    public ResolutionChain currentChain() {
        List<SkinSource> sources = new ArrayList<>(definitions.size());
        for (String name : definitions.keySet()) {
            SkinSource source = cache.get(name);
            if (source == MISSING_SOURCE) {
                log.trace("Skin source '{}' missing, leaving it out of the chain", name);
                continue;
            }
            sources.add(source);
        }
        return ResolutionChain.of(sources);
    }

    @Override
    public List<String> sourceNames() {
        return List.copyOf(definitions.keySet());
    }

    @Override
    public void refresh() {
        log.info("Refreshing skin sources {}", definitions.keySet());
        cache.invalidateAll();
    }

    /**
     * 加载配置源（被 Caffeine LoadingCache 调用）。
     *
     * @throws IllegalStateException 读取 skin.ini 或应用内联配置失败
     */
    private SkinSource loadSource(String name) {
        IrisProperties.Source def = definitions.get(name);
        log.debug("Loading skin source '{}'", name);
        try {
            SkinConfiguration config = def.ini() == null || def.ini().isBlank()
                    ? new SkinConfiguration()
                    : decoder.decode(Path.of(def.ini()));
            applyOverrides(def, config);

            Path assets = def.assets() == null || def.assets().isBlank() ? null : Path.of(def.assets());
            SkinSource source = new SkinSource(name, config, assets);
            log.trace("Loaded skin source '{}': {}", name, config);
            return source;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load skin source " + name, e);
        }
    }

    private static void applyOverrides(IrisProperties.Source def, SkinConfiguration config) {
        if (def.settings() != null) {
            def.settings().forEach(config::setSetting);
        }
        if (def.colours() != null) {
            def.colours().forEach((key, value) -> config.setCustomColour(key, requireColour(key, value)));
        }
        if (def.comboColours() != null && !def.comboColours().isEmpty()) {
            config.setComboColours(def.comboColours().stream()
                    .map(value -> requireColour("comboColours", value))
                    .toList());
        }
        if (def.allowDefaultComboColoursFallback() != null) {
            config.setAllowDefaultComboColoursFallback(def.allowDefaultComboColoursFallback());
        }
        if (def.version() != null) {
            config.setLegacyVersion(def.version());
        }
    }

    private static Colour4 requireColour(String key, String value) {
        Colour4 colour = Colour4.parse(value);
        if (colour == null) {
            throw new IllegalArgumentException("Invalid colour '" + value + "' for " + key);
        }
        return colour;
    }

    private static Map<String, IrisProperties.Source> indexDefinitions(List<IrisProperties.Source> sources) {
        Map<String, IrisProperties.Source> index = new LinkedHashMap<>();
        for (IrisProperties.Source source : sources) {
            if (source.name() == null || source.name().isBlank()) {
                throw new IllegalArgumentException("Skin source name required");
            }
            if (index.putIfAbsent(source.name(), source) != null) {
                throw new IllegalArgumentException("Duplicate skin source name: " + source.name());
            }
        }
        return index;
    }

    private static ExecutorService createRefreshExecutor() {
        return Executors.newFixedThreadPool(REFRESH_POOL_SIZE, r -> {
            Thread t = new Thread(r, "skin-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 关闭注册表，停止刷新线程池。由 Spring 容器在销毁 Bean 时调用。
     */
    @PreDestroy
    @Override
    public void close() {
        if (refreshPool.isShutdown()) return;
        log.info("Shutting down skin source registry");
        refreshPool.shutdownNow();
    }
}
