package com.edge.counter.core.camera;

import com.edge.counter.exception.DecodeException;
import org.opencv.core.Mat;
import org.opencv.videoio.VideoCapture;
import org.opencv.videoio.Videoio;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 本地摄像头（按设备索引）
 */
public class LocalCameraSource implements CameraSource {
    private static final Logger logger = LoggerFactory.getLogger(LocalCameraSource.class);
    private final int index;
    private VideoCapture capture;

    public LocalCameraSource(int index) {
        this.index = index;
    }

    @Override
    public boolean open() {
        String osName = System.getProperty("os.name").toLowerCase();
        int backend;

        if (osName.contains("mac") || osName.contains("darwin")) {
            backend = Videoio.CAP_AVFOUNDATION;
        } else if (osName.contains("win")) {
            backend = Videoio.CAP_DSHOW;
        } else {
            backend = Videoio.CAP_V4L2;
        }

        capture = new VideoCapture(index, backend);

        // 如果指定后端失败，尝试默认方式
        if (!capture.isOpened()) {
            logger.warn("Failed to open local camera {} with backend {}, trying default...", index, backend);
            capture.release();
            capture = new VideoCapture(index);
        }

        if (!capture.isOpened()) {
            logger.error("Failed to open local camera {}", index);
            return false;
        }

        logger.info("Opened local camera {}: {}x{}", index, getWidth(), getHeight());
        return true;
    }

    @Override
    public Mat read() {
        if (capture == null || !capture.isOpened()) {
            return null;
        }

        Mat frame = new Mat();
        boolean success;
        try {
            success = capture.read(frame);
        } catch (RuntimeException e) {
            frame.release();
            throw new DecodeException("Failed to read frame from local camera " + index, e);
        }

        if (!success || frame.empty()) {
            frame.release();
            return null;
        }

        return frame;
    }

    @Override
    public void close() {
        if (capture != null) {
            capture.release();
            capture = null;
        }
    }

    @Override
    public boolean isOpened() {
        return capture != null && capture.isOpened();
    }

    @Override
    public int getWidth() {
        return capture != null ? (int) capture.get(Videoio.CAP_PROP_FRAME_WIDTH) : 0;
    }

    @Override
    public int getHeight() {
        return capture != null ? (int) capture.get(Videoio.CAP_PROP_FRAME_HEIGHT) : 0;
    }

    @Override
    public double getFps() {
        return capture != null ? capture.get(Videoio.CAP_PROP_FPS) : 0.0;
    }

    @Override
    public String describe() {
        return "local:" + index;
    }
}
