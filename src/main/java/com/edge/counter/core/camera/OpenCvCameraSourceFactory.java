package com.edge.counter.core.camera;

import org.springframework.stereotype.Component;

/**
 * 基于 OpenCV VideoCapture 的源工厂
 * <ul>
 *   <li>"rtsp://..." / "http://..." / 文件路径: {@link RTSPCameraSource}</li>
 *   <li>数字字符串 ("0", "1"): 本地摄像头索引 {@link LocalCameraSource}</li>
 * </ul>
 */
@Component
public class OpenCvCameraSourceFactory implements CameraSourceFactory {

    @Override
    public CameraSource create(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("Camera source cannot be empty");
        }

        String src = uri.trim();
        if (src.toLowerCase().startsWith("rtsp://")) {
            return new RTSPCameraSource(src);
        }

        // 尝试作为数字字符串解析（本地摄像头索引）
        try {
            int index = Integer.parseInt(src);
            return new LocalCameraSource(index);
        } catch (NumberFormatException e) {
            return new RTSPCameraSource(src);
        }
    }
}
