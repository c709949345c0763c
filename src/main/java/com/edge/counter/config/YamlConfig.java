package com.edge.counter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "edge-counter")
public class YamlConfig {
    private SystemConfig system = new SystemConfig();
    private ModelConfig models = new ModelConfig();
    private CameraConfig cameras = new CameraConfig();
    private PoolConfig pool = new PoolConfig();

    @Data
    public static class SystemConfig {
        private String deviceId = "edge-counter";
        private String version = "1.0.0";
    }

    @Data
    public static class ModelConfig {
        private String modelPath;      // YOLO ONNX 模型，未配置时不做检测
        private float confThres = 0.25f;
        private float iouThres = 0.45f;
        private String device = "CPU"; // CPU 或 GPU
        private List<String> classNames = new ArrayList<>(List.of("staff", "customer"));
    }

    @Data
    public static class CameraConfig {
        // %d 替换为通道号
        private String rtspUrlTemplate = "rtsp://127.0.0.1:554/unicast/c%d/s0/live";
        private int minChannel = 1;
        private int maxChannel = 30;
        private long throttleMs = 200;         // 两次推理的最小间隔 (≈5 FPS)
        private long firstFrameWaitMs = 500;   // start 时等待第一帧的上限
        private long stopTimeoutMs = 5000;     // stop 等待解码线程退出的上限
        private int maxEmptyReads = 100;       // 连续读不到帧的次数上限，超过视为流结束
        private long emptyReadBackoffMs = 10;
        private int jpegQuality = 85;
        private List<Integer> autostart = new ArrayList<>(); // 启动后自动打开的通道
    }

    @Data
    public static class PoolConfig {
        private int workers = 0;               // 0 表示 CPU 核数
        private boolean offloadDetection = false; // 推理交给线程池，不占用解码线程
        private long shutdownTimeoutMs = 5000;
    }
}
