package com.ddm.iris.config;

import com.ddm.iris.chain.ResolutionChain;

import java.util.List;

/**
 * 配置源注册表：按配置定义构建配置源，并提供当前的解析链。
 *
 * @author liyifei
 * @since 1.0
 */
public interface SkinSourceRegistry extends AutoCloseable {

    /**
     * 以当前已加载的配置源构建解析链，顺序与配置定义一致。
     * 每次调用返回不可变的新解析链。
     */
    ResolutionChain currentChain();

    /**
     * 配置定义中的配置源名称（按优先级）。
     */
    List<String> sourceNames();

    /**
     * 丢弃已加载的配置源，下次访问时重新加载。
     */
    void refresh();

    @Override
    default void close() {
    }
}
