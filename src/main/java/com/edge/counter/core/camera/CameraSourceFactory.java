package com.edge.counter.core.camera;

/**
 * 根据源地址创建 {@link CameraSource}
 */
@FunctionalInterface
public interface CameraSourceFactory {

    /**
     * @param uri 源地址
     * @throws IllegalArgumentException 地址无法识别
     */
    CameraSource create(String uri);
}
