package com.ddm.iris;

import com.ddm.iris.chain.ResolutionChain;
import com.ddm.iris.defined.Bindable;
import com.ddm.iris.defined.SkinAsset;
import com.ddm.iris.defined.SkinLookup;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * 消费方使用的统一入口，把查找请求转发给当前的 {@link ResolutionChain}。
 * <p>
 * 解析链由 {@code Supplier} 提供：配置源集合变化时上游重建解析链，
 * 每次调用只读取一次当前解析链，因此成员变化只会在两次调用之间生效。
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * SkinRequester requester = SkinRequester.of(ResolutionChain.of(beatmapSource, userSource));
 * Bindable<Float> scale = requester.getConfig(SkinLookups.setting("CursorScale", Float.class));
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
public class SkinRequester implements Skin {

    private static final Logger log = LoggerFactory.getLogger(SkinRequester.class);

    private final Supplier<ResolutionChain> chain;

    public SkinRequester(Supplier<ResolutionChain> chain) {
        this.chain = Objects.requireNonNull(chain, "chain");
    }

    public static SkinRequester of(ResolutionChain chain) {
        Objects.requireNonNull(chain, "chain");
        return new SkinRequester(() -> chain);
    }

    @Override
    @Nullable
    public <T> Bindable<T> getConfig(SkinLookup<T> lookup) {
        return current().resolve(lookup);
    }

    @Override
    @Nullable
    public SkinAsset getTexture(String componentName) {
        return current().getTexture(componentName);
    }

    @Override
    @Nullable
    public SkinAsset getSample(String sampleName) {
        return current().getSample(sampleName);
    }

    private ResolutionChain current() {
        ResolutionChain c = chain.get();
        if (c == null) {
            log.debug("No resolution chain available, resolving against an empty chain");
            return ResolutionChain.empty();
        }
        return c;
    }
}
