package com.edge.counter.core.infer;

import com.edge.counter.model.DetectionResult;
import org.opencv.core.Mat;

/**
 * 员工/顾客检测器
 * <p>
 * 同步阻塞调用，可能使用 GPU。实现必须允许多个线程并发调用。
 */
public interface Detector {

    /**
     * @param frame BGR 图像，调用方持有所有权
     */
    DetectionResult infer(Mat frame);

    /**
     * 模型是否已加载
     */
    default boolean isReady() {
        return true;
    }
}
