package com.edge.counter.util;

import com.edge.counter.config.NativeLibraryLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;

import static org.junit.jupiter.api.Assertions.*;

class ImageCodecTest {

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @Test
    void testToJpeg_NullOrEmpty_ReturnsNull() {
        assertNull(ImageCodec.toJpeg(null, 85));
        Mat empty = new Mat();
        assertNull(ImageCodec.toJpeg(empty, 85));
        empty.release();
    }

    @Test
    void testToJpeg_DecodesBackToSameSize() {
        Mat frame = new Mat(48, 64, CvType.CV_8UC3, new Scalar(10, 200, 30));
        byte[] jpeg = ImageCodec.toJpeg(frame, 85);
        frame.release();

        assertNotNull(jpeg);
        assertEquals((byte) 0xFF, jpeg[0]);
        assertEquals((byte) 0xD8, jpeg[1]);

        MatOfByte buf = new MatOfByte(jpeg);
        Mat decoded = Imgcodecs.imdecode(buf, Imgcodecs.IMREAD_COLOR);
        try {
            assertEquals(64, decoded.cols());
            assertEquals(48, decoded.rows());
        } finally {
            buf.release();
            decoded.release();
        }
    }

    @Test
    void testToJpeg_LowerQualityIsSmaller() {
        Mat frame = new Mat(240, 320, CvType.CV_8UC3);
        org.opencv.core.Core.randu(frame, 0, 255);

        byte[] high = ImageCodec.toJpeg(frame, 95);
        byte[] low = ImageCodec.toJpeg(frame, 20);
        frame.release();

        assertNotNull(high);
        assertNotNull(low);
        assertTrue(low.length < high.length);
    }
}
