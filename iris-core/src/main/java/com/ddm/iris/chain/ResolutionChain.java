package com.ddm.iris.chain;

import com.ddm.iris.Skin;
import com.ddm.iris.defined.Bindable;
import com.ddm.iris.defined.GlobalColourLookup;
import com.ddm.iris.defined.GlobalSkinColour;
import com.ddm.iris.defined.LegacySetting;
import com.ddm.iris.defined.LegacySettingLookup;
import com.ddm.iris.defined.SkinAsset;
import com.ddm.iris.defined.SkinLookup;
import com.ddm.iris.source.SkinSource;
import com.ddm.iris.store.SkinConfiguration;
import com.ddm.iris.utils.CoercionResult;
import com.ddm.iris.utils.Converters;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * 解析链：按顺序排列的配置源（越具体越靠前，如谱面皮肤在用户皮肤之前）。
 *
 * <p><strong>解析算法：</strong>
 * <ol>
 *   <li>校验查找键与目标类型是否兼容，不兼容直接抛出
 *       {@link com.ddm.iris.LookupContractException}</li>
 *   <li>第一轮：依次询问每个配置源，第一个成功的值立即返回（包装为新的 {@link Bindable}），
 *       后续配置源不再查询；转换失败视为"本源无可用值"，继续下一个</li>
 *   <li>全部落空后按类别回退：
 *     <ul>
 *       <li>combo 调色板：第二轮按相同顺序检查 allowDefaultComboColoursFallback，
 *           任一配置源显式禁止则返回 null，否则返回默认调色板</li>
 *       <li>版本：返回 {@link SkinConfiguration#LATEST_VERSION}</li>
 *       <li>其他：返回 null（缺失，不是错误）</li>
 *     </ul>
 *   </li>
 * </ol>
 *
 * <p>解析链是不可变的。配置源集合变化时通过 {@link #of}、{@link #prepend}、{@link #without}
 * 重新构建，正在进行的解析不会看到成员变化。
 *
 * @author liyifei
 * @since 1.0
 */
public final class ResolutionChain implements Skin {

    private static final Logger log = LoggerFactory.getLogger(ResolutionChain.class);

    private static final ResolutionChain EMPTY = new ResolutionChain(List.of());

    private final List<SkinSource> sources;

    private ResolutionChain(List<SkinSource> sources) {
        this.sources = List.copyOf(sources);
    }

    public static ResolutionChain empty() {
        return EMPTY;
    }

    /**
     * @param sources 配置源，最具体的在前
     */
    public static ResolutionChain of(SkinSource... sources) {
        return of(Arrays.asList(sources));
    }

    public static ResolutionChain of(List<SkinSource> sources) {
        Objects.requireNonNull(sources, "sources");
        return sources.isEmpty() ? EMPTY : new ResolutionChain(sources);
    }

    /**
     * 当前的配置源顺序（不可修改）。
     */
    public List<SkinSource> sources() {
        return sources;
    }

    /**
     * 构建一条新的解析链，把 {@code source} 作为最具体的配置源放在最前面。
     */
    public ResolutionChain prepend(SkinSource source) {
        List<SkinSource> next = new ArrayList<>(sources.size() + 1);
        next.add(Objects.requireNonNull(source, "source"));
        next.addAll(sources);
        return new ResolutionChain(next);
    }

    /**
     * 构建一条新的解析链，把 {@code source} 作为最不具体的配置源放在最后面。
     */
    public ResolutionChain append(SkinSource source) {
        List<SkinSource> next = new ArrayList<>(sources);
        next.add(Objects.requireNonNull(source, "source"));
        return new ResolutionChain(next);
    }

    /**
     * 构建一条去掉指定名称配置源的新解析链。
     */
    public ResolutionChain without(String sourceName) {
        List<SkinSource> next = sources.stream()
                .filter(s -> !s.name().equals(sourceName))
                .toList();
        return next.size() == sources.size() ? this : of(next);
    }

    @Override
    @Nullable
    public <T> Bindable<T> getConfig(SkinLookup<T> lookup) {
        return resolve(lookup);
    }

    /**
     * 解析查找键。
     *
     * @return 新建的可观察值；没有配置源提供且无适用默认值时返回 null
     * @throws com.ddm.iris.LookupContractException 查找键与目标类型不兼容
     */
    @Nullable
    public <T> Bindable<T> resolve(SkinLookup<T> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        Converters.requireCompatible(lookup);

        for (SkinSource source : sources) {
            Optional<CoercionResult<T>> local = source.tryGetLocal(lookup);
            if (local.isEmpty()) continue;

            CoercionResult<T> result = local.get();
            if (result instanceof CoercionResult.Success<T> ok) {
                log.trace("Resolved {} from source '{}': {}", lookup, source.name(), ok.value());
                return new Bindable<>(ok.value());
            }
            if (result instanceof CoercionResult.Failure<T> failed) {
                log.debug("Source '{}' has no usable value for {}: {}", source.name(), lookup, failed.failure());
            }
        }
        return fallback(lookup);
    }

    @Override
    @Nullable
    public SkinAsset getTexture(String componentName) {
        return firstAsset(s -> s.getTexture(componentName));
    }

    @Override
    @Nullable
    public SkinAsset getSample(String sampleName) {
        return firstAsset(s -> s.getSample(sampleName));
    }

    @Nullable
    @SuppressWarnings("unchecked")
    private <T> Bindable<T> fallback(SkinLookup<T> lookup) {
        if (lookup instanceof GlobalColourLookup<?> g && g.colour() == GlobalSkinColour.COMBO_COLOURS) {
            if (!defaultComboColoursAllowed()) return null;
            log.trace("No source defines combo colours, using default palette");
            return new Bindable<>((T) SkinConfiguration.DEFAULT_COMBO_COLOURS);
        }
        if (lookup instanceof LegacySettingLookup<?> l && l.setting() == LegacySetting.VERSION) {
            log.trace("No source defines a version, using latest {}", SkinConfiguration.LATEST_VERSION);
            return new Bindable<>((T) SkinConfiguration.LATEST_VERSION);
        }
        log.trace("No source defines {}", lookup);
        return null;
    }

    /**
     * 第二轮：只在第一轮没有找到任何非空调色板时执行，任一配置源显式禁止即不回退。
     */
    private boolean defaultComboColoursAllowed() {
        for (SkinSource source : sources) {
            if (!source.configuration().isAllowDefaultComboColoursFallback()) {
                log.debug("Source '{}' disallows default combo colours fallback", source.name());
                return false;
            }
        }
        return true;
    }

    @Nullable
    private SkinAsset firstAsset(Function<SkinSource, SkinAsset> locator) {
        for (SkinSource source : sources) {
            SkinAsset asset = locator.apply(source);
            if (asset != null) return asset;
        }
        return null;
    }

    @Override
    public String toString() {
        return "ResolutionChain" + sources.stream().map(SkinSource::name).toList();
    }
}
