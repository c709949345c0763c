package com.edge.counter.controller;

import com.edge.counter.config.YamlConfig;
import com.edge.counter.core.pool.WorkerPool;
import com.edge.counter.model.CameraStats;
import com.edge.counter.service.CameraManager;
import com.edge.counter.service.DetectorService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 统计与健康检查
 */
@Tag(name = "系统状态", description = "全局统计和健康检查")
@RestController
@RequestMapping("/api")
public class SystemController {

    @Autowired
    private CameraManager cameraManager;

    @Autowired
    private WorkerPool workerPool;

    @Autowired
    private DetectorService detectorService;

    @Autowired
    private YamlConfig yamlConfig;

    @Operation(summary = "全部通道统计", description = "各通道统计、汇总人数和线程池状态")
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getAllStats() {
        List<CameraStats> cameras = cameraManager.getAllStats();

        int totalStaff = 0;
        int totalCustomer = 0;
        long totalFrames = 0;
        for (CameraStats stats : cameras) {
            totalStaff += stats.getStaffCount();
            totalCustomer += stats.getCustomerCount();
            totalFrames += stats.getTotalFrames();
        }

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("numCameras", cameras.size());
        summary.put("totalStaff", totalStaff);
        summary.put("totalCustomer", totalCustomer);
        summary.put("totalFrames", totalFrames);

        Map<String, Object> threadPool = new LinkedHashMap<>();
        threadPool.put("numThreads", workerPool.size());
        threadPool.put("pendingTasks", workerPool.pending());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("cameras", cameras);
        result.put("summary", summary);
        result.put("threadPool", threadPool);
        result.put("timestamp", Instant.now().toString());
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "单通道统计")
    @GetMapping("/stats/{channel}")
    public ResponseEntity<Object> getStats(
            @Parameter(description = "通道号", required = true, example = "18")
            @PathVariable int channel) {
        return cameraManager.getStats(channel)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> {
                    Map<String, Object> response = new LinkedHashMap<>();
                    response.put("status", "error");
                    response.put("message", "Camera " + channel + " not found");
                    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
                });
    }

    @Operation(summary = "健康检查", description = "服务版本、模型加载状态和运行中的通道数")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> inputSize = new LinkedHashMap<>();
        inputSize.put("width", detectorService.getInputWidth());
        inputSize.put("height", detectorService.getInputHeight());

        Map<String, Object> model = new LinkedHashMap<>();
        model.put("loaded", detectorService.isReady());
        model.put("inputSize", inputSize);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("status", "ok");
        result.put("timestamp", Instant.now().toString());
        result.put("service", yamlConfig.getSystem().getDeviceId());
        result.put("version", yamlConfig.getSystem().getVersion());
        result.put("model", model);
        result.put("activeCameras", cameraManager.getActiveCount());
        return ResponseEntity.ok(result);
    }
}
