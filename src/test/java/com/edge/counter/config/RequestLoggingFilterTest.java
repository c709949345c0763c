package com.edge.counter.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestLoggingFilterTest {

    @Test
    void testIsImagePath_ImageEndpointsBypassBodyCaching() {
        assertTrue(RequestLoggingFilter.isImagePath("/stream/mjpeg/18"));
        assertTrue(RequestLoggingFilter.isImagePath("/api/camera/18/snapshot"));
        assertTrue(RequestLoggingFilter.isImagePath("/api/camera/18/frame"));

        assertFalse(RequestLoggingFilter.isImagePath("/api/camera/start"));
        assertFalse(RequestLoggingFilter.isImagePath("/api/stats"));
        assertFalse(RequestLoggingFilter.isImagePath("/api/camera/18/status"));
    }
}
