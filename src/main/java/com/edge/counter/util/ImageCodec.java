package com.edge.counter.util;

import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 图像编码工具
 */
public final class ImageCodec {
    private static final Logger logger = LoggerFactory.getLogger(ImageCodec.class);

    private ImageCodec() {
    }

    /**
     * 编码为 JPEG
     *
     * @param quality JPEG 质量 (1-100)
     * @return JPEG 字节；帧为空或编码失败返回 null
     */
    public static byte[] toJpeg(Mat frame, int quality) {
        if (frame == null || frame.empty()) {
            return null;
        }

        MatOfByte mob = new MatOfByte();
        MatOfInt params = new MatOfInt(Imgcodecs.IMWRITE_JPEG_QUALITY, quality);
        try {
            if (Imgcodecs.imencode(".jpg", frame, mob, params)) {
                byte[] bytes = mob.toArray();
                return bytes.length > 0 ? bytes : null;
            }
            logger.warn("JPEG encoding failed for {}x{} frame", frame.cols(), frame.rows());
            return null;
        } finally {
            mob.release();
            params.release();
        }
    }
}
