package com.edge.counter.core.camera;

import com.edge.counter.exception.DecodeException;
import org.opencv.core.Mat;
import org.opencv.videoio.VideoCapture;
import org.opencv.videoio.Videoio;

/**
 * 网络流 / 视频文件源，解码由 OpenCV (FFmpeg 后端) 完成
 */
public class RTSPCameraSource implements CameraSource {
    private final String rtspUrl;
    private VideoCapture capture;

    public RTSPCameraSource(String rtspUrl) {
        this.rtspUrl = rtspUrl;
    }

    @Override
    public boolean open() {
        capture = new VideoCapture(rtspUrl, Videoio.CAP_FFMPEG);
        if (!capture.isOpened()) {
            // FFmpeg 后端不可用时退回默认后端
            capture.release();
            capture = new VideoCapture(rtspUrl);
        }
        return capture.isOpened();
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
            throw new DecodeException("Failed to read frame from " + rtspUrl, e);
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
        return rtspUrl;
    }
}
