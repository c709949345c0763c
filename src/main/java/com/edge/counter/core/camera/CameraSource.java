package com.edge.counter.core.camera;

import org.opencv.core.Mat;

/**
 * 视频源：由 {@link StreamWorker} 在解码线程上依次调用 open / read / close
 */
public interface CameraSource {
    /**
     * 打开视频源
     * @return 是否成功打开
     */
    boolean open();

    /**
     * 读取并解码一帧 (BGR)
     * @return 图像帧，调用方负责 release；暂时没有可用帧返回 null
     * @throws com.edge.counter.exception.DecodeException 读取或解码出错
     */
    Mat read();

    /**
     * 关闭视频源
     */
    void close();

    /**
     * 检查视频源是否已打开
     */
    boolean isOpened();

    /**
     * 视频源报告的宽度，未知时返回 0
     */
    int getWidth();

    int getHeight();

    /**
     * 视频源报告的帧率，未知时返回 0
     */
    double getFps();

    /**
     * 源地址（用于日志）
     */
    String describe();
}
