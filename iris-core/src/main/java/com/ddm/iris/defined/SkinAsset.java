package com.ddm.iris.defined;

import java.nio.file.Path;

/**
 * 已定位（未解码）的皮肤资源文件。
 *
 * @author liyifei
 * @param name     请求的组件名称
 * @param kind     资源种类
 * @param location 资源文件路径
 * @param source   提供该资源的配置源名称
 */
public record SkinAsset(String name, Kind kind, Path location, String source) {

    public enum Kind {
        TEXTURE,
        SAMPLE
    }
}
