package com.ddm.iris.source;

import com.ddm.iris.defined.CustomColourLookup;
import com.ddm.iris.defined.EnumSettingLookup;
import com.ddm.iris.defined.GlobalColourLookup;
import com.ddm.iris.defined.GlobalSkinColour;
import com.ddm.iris.defined.LegacySetting;
import com.ddm.iris.defined.LegacySettingLookup;
import com.ddm.iris.defined.SettingLookup;
import com.ddm.iris.defined.SkinAsset;
import com.ddm.iris.defined.SkinLookup;
import com.ddm.iris.store.SkinConfiguration;
import com.ddm.iris.store.SkinConfiguration.SettingValue;
import com.ddm.iris.utils.CoercionResult;
import com.ddm.iris.utils.Converters;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 配置源：包装一个 {@link SkinConfiguration}，回答"本源是否直接提供该查找键的值"。
 *
 * <p>{@link #tryGetLocal(SkinLookup)} 的返回值：
 * <ul>
 *   <li>{@code Optional.empty()}：本源没有定义该键，解析链继续</li>
 *   <li>{@link CoercionResult.Failure}：键存在但值无法转换，对解析链而言等同于"本源无可用值"</li>
 *   <li>{@link CoercionResult.Success}：已解析的值（可以是显式的 null）</li>
 * </ul>
 *
 * <p>按查找键类别分派：
 * <ul>
 *   <li>自由文本/枚举 → settings</li>
 *   <li>命名颜色 → customColours</li>
 *   <li>combo 调色板 → 仅在非空时返回；空表示"本源未定义"，交给解析链的回退策略</li>
 *   <li>其他全局颜色 → customColours 中的固定名称</li>
 *   <li>版本 → 仅在 legacyVersion 非 null 时返回</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public final class SkinSource {

    private static final Logger log = LoggerFactory.getLogger(SkinSource.class);

    private static final List<String> TEXTURE_SUFFIXES = List.of("@2x.png", ".png", ".jpg");
    private static final List<String> SAMPLE_SUFFIXES = List.of(".wav", ".ogg", ".mp3");

    private final String name;
    private final SkinConfiguration configuration;
    @Nullable
    private final Path assetRoot;

    public SkinSource(String name, SkinConfiguration configuration) {
        this(name, configuration, null);
    }

    /**
     * @param name          配置源名称，用于日志与资源归属
     * @param configuration 本源独占的配置存储
     * @param assetRoot     资源目录，为 null 时本源不提供资源
     */
    public SkinSource(String name, SkinConfiguration configuration, @Nullable Path assetRoot) {
        this.name = Objects.requireNonNull(name, "name");
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.assetRoot = assetRoot == null ? null : assetRoot.toAbsolutePath().normalize();
    }

    public String name() {
        return name;
    }

    public SkinConfiguration configuration() {
        return configuration;
    }

    /**
     * 查询本源直接定义的值。
     *
     * @throws com.ddm.iris.LookupContractException 结构化槽位与目标类型不兼容
     */
    public <T> Optional<CoercionResult<T>> tryGetLocal(SkinLookup<T> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        Converters.requireCompatible(lookup);

        if (lookup instanceof SettingLookup<?> s) {
            return lookupSetting(s.name(), lookup);
        }
        if (lookup instanceof EnumSettingLookup<?> e) {
            return lookupSetting(e.name(), lookup);
        }
        if (lookup instanceof CustomColourLookup<?> c) {
            return found(configuration.findCustomColour(c.name()));
        }
        if (lookup instanceof GlobalColourLookup<?> g) {
            if (g.colour() == GlobalSkinColour.COMBO_COLOURS) {
                List<?> combo = configuration.getComboColours();
                return combo.isEmpty() ? Optional.empty() : found(combo);
            }
            return found(configuration.findCustomColour(g.colour().skinKey()));
        }
        if (lookup instanceof LegacySettingLookup<?> l && l.setting() == LegacySetting.VERSION) {
            return found(configuration.getLegacyVersion());
        }
        return Optional.empty();
    }

    /**
     * 在资源目录中定位贴图。
     */
    @Nullable
    public SkinAsset getTexture(String componentName) {
        return locate(componentName, SkinAsset.Kind.TEXTURE, TEXTURE_SUFFIXES);
    }

    /**
     * 在资源目录中定位音效。
     */
    @Nullable
    public SkinAsset getSample(String sampleName) {
        return locate(sampleName, SkinAsset.Kind.SAMPLE, SAMPLE_SUFFIXES);
    }

    private <T> Optional<CoercionResult<T>> lookupSetting(String key, SkinLookup<T> lookup) {
        SettingValue entry = configuration.findSetting(key);
        if (entry == null) return Optional.empty();
        CoercionResult<T> result = Converters.coerce(entry.raw(), lookup.valueType());
        log.trace("Source '{}' coerced {} -> {}", name, lookup, result);
        return Optional.of(result);
    }

    @SuppressWarnings("unchecked")
    private static <T> Optional<CoercionResult<T>> found(@Nullable Object value) {
        return value == null ? Optional.empty() : Optional.of(CoercionResult.success((T) value));
    }

    @Nullable
    private SkinAsset locate(String component, SkinAsset.Kind kind, List<String> suffixes) {
        if (assetRoot == null || component == null || component.isBlank()) return null;
        for (String suffix : suffixes) {
            Path candidate;
            try {
                candidate = assetRoot.resolve(component + suffix).normalize();
            } catch (InvalidPathException e) {
                log.debug("Invalid {} name '{}' in source '{}': {}", kind, component, name, e.getMessage());
                return null;
            }
            // 禁止通过 ../ 逃逸出资源目录
            if (!candidate.startsWith(assetRoot)) {
                log.warn("Rejected {} lookup '{}' outside asset root of source '{}'", kind, component, name);
                return null;
            }
            if (Files.isRegularFile(candidate)) {
                return new SkinAsset(component, kind, candidate, name);
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return "SkinSource[" + name + "]";
    }
}
