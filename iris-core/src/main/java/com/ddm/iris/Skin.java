package com.ddm.iris;

import com.ddm.iris.defined.Bindable;
import com.ddm.iris.defined.SkinAsset;
import com.ddm.iris.defined.SkinLookup;
import jakarta.annotation.Nullable;

/**
 * 皮肤能力接口：配置查找与资源定位。
 *
 * <p>{@link #getConfig(SkinLookup)} 的三种结果需要调用方区分：
 * <ul>
 *   <li>返回 null：没有任何配置源提供该值，且没有适用的默认值</li>
 *   <li>返回的 {@link Bindable} 持有 null：配置源显式地把该值配置为空</li>
 *   <li>抛出 {@link LookupContractException}：查找键与目标类型的组合不成立</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public interface Skin {

    /**
     * 解析配置值。
     *
     * @param lookup 查找键
     * @param <T>    目标类型
     * @return 新建的可观察值；没有可用值时返回 null
     * @throws LookupContractException 查找键与目标类型不兼容
     */
    @Nullable
    <T> Bindable<T> getConfig(SkinLookup<T> lookup);

    /**
     * 定位贴图资源（不解码）。
     */
    @Nullable
    SkinAsset getTexture(String componentName);

    /**
     * 定位音效资源（不解码）。
     */
    @Nullable
    SkinAsset getSample(String sampleName);
}
