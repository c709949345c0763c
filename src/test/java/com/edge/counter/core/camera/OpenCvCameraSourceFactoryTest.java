package com.edge.counter.core.camera;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OpenCvCameraSourceFactoryTest {

    private final OpenCvCameraSourceFactory factory = new OpenCvCameraSourceFactory();

    @Test
    void testCreate_RtspUrl_NetworkSource() {
        CameraSource source = factory.create(" rtsp://nvr:554/unicast/c3/s0/live ");

        assertTrue(source instanceof RTSPCameraSource);
        assertEquals("rtsp://nvr:554/unicast/c3/s0/live", source.describe());
        assertFalse(source.isOpened());
    }

    @Test
    void testCreate_DeviceIndex_LocalSource() {
        CameraSource source = factory.create("0");

        assertTrue(source instanceof LocalCameraSource);
    }

    @Test
    void testCreate_FilePath_NetworkSource() {
        assertTrue(factory.create("/data/videos/ch18.mp4") instanceof RTSPCameraSource);
    }

    @Test
    void testCreate_Blank_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> factory.create("  "));
        assertThrows(IllegalArgumentException.class, () -> factory.create(null));
    }
}
