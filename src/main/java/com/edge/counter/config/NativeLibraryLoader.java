package com.edge.counter.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Native Library Loader
 * 负责在任何 OpenCV 调用之前加载 JNI 库
 */
public final class NativeLibraryLoader {

    private static final Logger logger = LoggerFactory.getLogger(NativeLibraryLoader.class);

    private static boolean loaded = false;

    private NativeLibraryLoader() {
    }

    /**
     * 预加载 OpenCV native 库；ONNX Runtime 在创建 OrtEnvironment 时自行加载
     */
    public static synchronized void loadNativeLibraries() {
        if (loaded) {
            return;
        }

        try {
            // openpnp 会把与平台匹配的库解压到临时目录再加载
            nu.pattern.OpenCV.loadLocally();
            logger.info("OpenCV {} loaded via openpnp", org.opencv.core.Core.VERSION);
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            logger.error("Failed to load OpenCV native library: {}", e.getMessage());
            throw new IllegalStateException("Failed to load OpenCV", e);
        }

        loaded = true;
    }
}
