package com.ddm.iris.autoconfigure;

import com.ddm.iris.SkinRequester;
import com.ddm.iris.config.DefaultSkinSourceRegistry;
import com.ddm.iris.config.IrisProperties;
import com.ddm.iris.config.SkinSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Iris 皮肤配置的自动配置类。
 * <p>自动配置以下组件：
 * <ul>
 *   <li>{@link SkinSourceRegistry}：按 {@code iris.skin.sources} 加载配置源</li>
 *   <li>{@link SkinRequester}：消费方使用的查找入口，每次调用读取注册表的当前解析链</li>
 * </ul>
 *
 * @see IrisProperties
 * @since 1.0
 */
@AutoConfiguration
@EnableConfigurationProperties(IrisProperties.class)
/**
 * {@link IrisAutoConfiguration} 类的单元测试。
 *
 * @author liyifei
 */
public class IrisAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IrisAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public SkinSourceRegistry skinSourceRegistry(IrisProperties props) {
        return new DefaultSkinSourceRegistry(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public SkinRequester skinRequester(SkinSourceRegistry registry) {
        log.info("Registering SkinRequester backed by {}", registry.getClass().getSimpleName());
        return new SkinRequester(registry::currentChain);
    }
}
