package com.edge.counter.core.camera;

import org.opencv.core.Mat;

/**
 * 帧回调，在解码线程上同步执行
 * <p>
 * 传入的 Mat 在回调返回后会被释放，需要保留时请 clone()。
 */
@FunctionalInterface
public interface FrameCallback {
    void onFrame(Mat frame);
}
