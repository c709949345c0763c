package com.edge.counter.controller;

import com.edge.counter.config.YamlConfig;
import com.edge.counter.core.pool.WorkerPool;
import com.edge.counter.exception.CameraAlreadyRunningException;
import com.edge.counter.exception.CameraNotFoundException;
import com.edge.counter.exception.InvalidChannelException;
import com.edge.counter.model.CameraStats;
import com.edge.counter.service.CameraManager;
import com.edge.counter.service.DetectorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {CameraController.class, StreamController.class, SystemController.class})
class CameraControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CameraManager cameraManager;

    @MockBean
    private WorkerPool workerPool;

    @MockBean
    private DetectorService detectorService;

    @MockBean
    private YamlConfig yamlConfig;

    private static CameraStats stats(int channel, int staff, int customer, long frames) {
        return CameraStats.builder()
                .channel(channel)
                .uri("rtsp://cam/" + channel)
                .running(true)
                .state("STREAMING")
                .width(1920)
                .height(1080)
                .fps(25.0)
                .totalFrames(frames)
                .staffCount(staff)
                .customerCount(customer)
                .avgInferenceMs(30.0)
                .build();
    }

    // ================== start / stop ==================

    @Test
    void testStart_Success() throws Exception {
        when(cameraManager.start(18, null)).thenReturn(stats(18, 0, 0, 0));

        mockMvc.perform(post("/api/camera/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\": 18}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.channel").value(18))
                .andExpect(jsonPath("$.data.uri").value("rtsp://cam/18"))
                .andExpect(jsonPath("$.data.streamUrl").value("/stream/mjpeg/18"));
    }

    @Test
    void testStart_WithUrl_PassedThrough() throws Exception {
        when(cameraManager.start(eq(2), eq("rtsp://10.0.0.5/live"))).thenReturn(stats(2, 0, 0, 0));

        mockMvc.perform(post("/api/camera/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\": 2, \"url\": \"rtsp://10.0.0.5/live\"}"))
                .andExpect(status().isOk());

        verify(cameraManager).start(2, "rtsp://10.0.0.5/live");
    }

    @Test
    void testStart_InvalidChannel_400() throws Exception {
        when(cameraManager.start(eq(99), isNull())).thenThrow(new InvalidChannelException(99, 1, 30));

        mockMvc.perform(post("/api/camera/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\": 99}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Invalid channel 99 (must be 1-30)"));
    }

    @Test
    void testStart_MissingChannel_400() throws Exception {
        mockMvc.perform(post("/api/camera/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));

        verify(cameraManager, never()).start(anyInt(), any());
    }

    @Test
    void testStart_AlreadyRunning_409() throws Exception {
        when(cameraManager.start(eq(5), isNull())).thenThrow(new CameraAlreadyRunningException(5));

        mockMvc.perform(post("/api/camera/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\": 5}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void testStop_Success() throws Exception {
        mockMvc.perform(post("/api/camera/stop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\": 18}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.data.channel").value(18));

        verify(cameraManager).stop(18);
    }

    @Test
    void testStop_NotRunning_404() throws Exception {
        doThrow(new CameraNotFoundException(4)).when(cameraManager).stop(4);

        mockMvc.perform(post("/api/camera/stop")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"channel\": 4}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    // ================== 状态与图像 ==================

    @Test
    void testStatus_RunningCamera() throws Exception {
        when(cameraManager.isRunning(18)).thenReturn(true);
        when(cameraManager.getStats(18)).thenReturn(Optional.of(stats(18, 1, 3, 500)));

        mockMvc.perform(get("/api/camera/18/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.running").value(true))
                .andExpect(jsonPath("$.data.stats.isRunning").value(true))
                .andExpect(jsonPath("$.data.stats.customerCount").value(3));
    }

    @Test
    void testStatus_UnknownCamera_NotRunning() throws Exception {
        when(cameraManager.getStats(3)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/camera/3/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.running").value(false))
                .andExpect(jsonPath("$.data.stats").doesNotExist());
    }

    @Test
    void testSnapshot_Available_Jpeg() throws Exception {
        byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, 1, 2, 3};
        when(cameraManager.getSnapshot(18)).thenReturn(Optional.of(jpeg));

        mockMvc.perform(get("/api/camera/18/snapshot"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_JPEG))
                .andExpect(content().bytes(jpeg));

        mockMvc.perform(get("/stream/mjpeg/18"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.IMAGE_JPEG));
    }

    @Test
    void testSnapshot_Unavailable_404() throws Exception {
        when(cameraManager.getSnapshot(anyInt())).thenReturn(Optional.empty());
        when(cameraManager.getLatestFrame(anyInt())).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/camera/18/snapshot")).andExpect(status().isNotFound());
        mockMvc.perform(get("/stream/mjpeg/18")).andExpect(status().isNotFound());
        mockMvc.perform(get("/api/camera/18/frame")).andExpect(status().isNotFound());
    }

    // ================== 统计 ==================

    @Test
    void testAllStats_SummaryAndThreadPool() throws Exception {
        when(cameraManager.getAllStats()).thenReturn(List.of(stats(1, 2, 3, 100), stats(2, 1, 4, 50)));
        when(workerPool.size()).thenReturn(8);
        when(workerPool.pending()).thenReturn(0);

        mockMvc.perform(get("/api/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cameras.length()").value(2))
                .andExpect(jsonPath("$.cameras[0].channel").value(1))
                .andExpect(jsonPath("$.cameras[0].isRunning").value(true))
                .andExpect(jsonPath("$.summary.numCameras").value(2))
                .andExpect(jsonPath("$.summary.totalStaff").value(3))
                .andExpect(jsonPath("$.summary.totalCustomer").value(7))
                .andExpect(jsonPath("$.summary.totalFrames").value(150))
                .andExpect(jsonPath("$.threadPool.numThreads").value(8))
                .andExpect(jsonPath("$.threadPool.pendingTasks").value(0))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    void testChannelStats_Unknown_404() throws Exception {
        when(cameraManager.getStats(11)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/stats/11"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void testChannelStats_Known() throws Exception {
        when(cameraManager.getStats(1)).thenReturn(Optional.of(stats(1, 2, 3, 100)));

        mockMvc.perform(get("/api/stats/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.channel").value(1))
                .andExpect(jsonPath("$.staffCount").value(2));
    }

    @Test
    void testHealth() throws Exception {
        YamlConfig.SystemConfig system = new YamlConfig.SystemConfig();
        when(yamlConfig.getSystem()).thenReturn(system);
        when(detectorService.isReady()).thenReturn(true);
        when(detectorService.getInputWidth()).thenReturn(640);
        when(detectorService.getInputHeight()).thenReturn(640);
        when(cameraManager.getActiveCount()).thenReturn(2);

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.model.loaded").value(true))
                .andExpect(jsonPath("$.model.inputSize.width").value(640))
                .andExpect(jsonPath("$.activeCameras").value(2));
    }
}
