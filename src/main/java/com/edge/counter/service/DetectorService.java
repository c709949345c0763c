package com.edge.counter.service;

import com.edge.counter.config.YamlConfig;
import com.edge.counter.core.infer.Detector;
import com.edge.counter.core.infer.YOLOInferenceEngine;
import com.edge.counter.model.Detection;
import com.edge.counter.model.DetectionResult;
import ai.onnxruntime.OrtException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

/**
 * 推理引擎服务
 * <p>
 * 统一管理 YOLO 员工/顾客检测引擎的单例。模型未配置或加载失败时 {@link #isReady()} 返回 false。
 */
@Service
public class DetectorService implements Detector {
    private static final Logger logger = LoggerFactory.getLogger(DetectorService.class);

    @Autowired
    private YamlConfig config;

    private YOLOInferenceEngine engine;

    @PostConstruct
    public void init() {
        YamlConfig.ModelConfig models = config.getModels();
        String modelPath = models.getModelPath();

        if (modelPath == null || modelPath.isEmpty()) {
            logger.warn("Model not configured - detection will be disabled");
            return;
        }
        if (!Files.exists(Paths.get(modelPath))) {
            logger.error("Model file not found: {}", modelPath);
            return;
        }

        try {
            engine = new YOLOInferenceEngine(
                    modelPath,
                    models.getConfThres(),
                    models.getIouThres(),
                    models.getDevice(),
                    models.getClassNames()
            );
            logger.info("Detector initialized: {} (input {}x{}, conf {}, iou {})",
                    modelPath, engine.getInputWidth(), engine.getInputHeight(),
                    models.getConfThres(), models.getIouThres());
        } catch (OrtException e) {
            logger.error("Failed to initialize detector: {}", e.getMessage(), e);
        }
    }

    @Override
    public DetectionResult infer(Mat frame) {
        if (engine == null) {
            throw new IllegalStateException("Detector not initialized");
        }

        long start = System.nanoTime();
        List<Detection> detections;
        try {
            detections = engine.predict(frame);
        } catch (OrtException e) {
            throw new IllegalStateException("Inference failed: " + e.getMessage(), e);
        }
        double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;

        DetectionResult result = DetectionResult.of(detections, elapsedMs);
        logger.debug("Inference: {} detections (staff {}, customer {}) in {} ms",
                detections.size(), result.getStaffCount(), result.getCustomerCount(),
                String.format("%.1f", elapsedMs));
        return result;
    }

    @Override
    public boolean isReady() {
        return engine != null;
    }

    public int getInputWidth() {
        return engine != null ? engine.getInputWidth() : 0;
    }

    public int getInputHeight() {
        return engine != null ? engine.getInputHeight() : 0;
    }

    @PreDestroy
    public void cleanup() {
        if (engine != null) {
            engine.close();
            logger.info("Detector closed");
        }
    }
}
