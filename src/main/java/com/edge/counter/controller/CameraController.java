package com.edge.counter.controller;

import com.edge.counter.dto.CameraStartRequest;
import com.edge.counter.dto.CameraStopRequest;
import com.edge.counter.exception.CameraAlreadyRunningException;
import com.edge.counter.exception.CameraNotFoundException;
import com.edge.counter.exception.InvalidChannelException;
import com.edge.counter.model.CameraStats;
import com.edge.counter.service.CameraManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 摄像头控制器
 *
 * 按通道启动、停止摄像头，查询状态和快照
 */
@RestController
@RequestMapping("/api/camera")
@Tag(name = "摄像头管理", description = "按通道启动、停止摄像头，查询状态和快照")
public class CameraController {
    private static final Logger logger = LoggerFactory.getLogger(CameraController.class);

    @Autowired
    private CameraManager cameraManager;

    // ================== 基础控制接口 ==================

    /**
     * 启动摄像头
     */
    @PostMapping("/start")
    @Operation(
            summary = "启动摄像头",
            description = """
                    启动指定通道的解码线程，并开始员工/顾客检测。

                    **注意事项**：
                    - 通道范围由 edge-counter.cameras.min-channel / max-channel 配置，默认 1-30
                    - url 为空时按 rtsp-url-template 生成地址
                    - 接口最多等待第一帧 first-frame-wait-ms（默认 500ms）后返回
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "摄像头已启动",
                    content = @Content(
                            mediaType = "application/json",
                            examples = @ExampleObject(
                                    name = "成功示例",
                                    value = """
                                            {
                                              "status": "success",
                                              "data": {
                                                "channel": 18,
                                                "uri": "rtsp://127.0.0.1:554/unicast/c18/s0/live",
                                                "streamUrl": "/stream/mjpeg/18"
                                              }
                                            }
                                            """
                            )
                    )
            ),
            @ApiResponse(responseCode = "400", description = "通道号无效"),
            @ApiResponse(responseCode = "409", description = "通道已在运行")
    })
    public ResponseEntity<Map<String, Object>> startCamera(@RequestBody CameraStartRequest request) {
        if (request == null || request.getChannel() == null) {
            return error(HttpStatus.BAD_REQUEST, "channel is required");
        }
        int channel = request.getChannel();

        try {
            CameraStats stats = cameraManager.start(channel, request.getUrl());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("channel", channel);
            data.put("uri", stats.getUri());
            data.put("isRunning", stats.isRunning());
            data.put("state", stats.getState());
            data.put("streamUrl", "/stream/mjpeg/" + channel);
            return success(data);
        } catch (InvalidChannelException e) {
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        } catch (CameraAlreadyRunningException e) {
            return error(HttpStatus.CONFLICT, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Start camera {} failed", channel, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    /**
     * 停止摄像头
     */
    @PostMapping("/stop")
    @Operation(summary = "停止摄像头", description = "停止指定通道的解码线程，释放资源")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "摄像头已停止"),
            @ApiResponse(responseCode = "404", description = "通道未运行")
    })
    public ResponseEntity<Map<String, Object>> stopCamera(@RequestBody CameraStopRequest request) {
        if (request == null || request.getChannel() == null) {
            return error(HttpStatus.BAD_REQUEST, "channel is required");
        }
        int channel = request.getChannel();

        try {
            cameraManager.stop(channel);
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("channel", channel);
            return success(data);
        } catch (CameraNotFoundException e) {
            return error(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Stop camera {} failed", channel, e);
            return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    /**
     * 获取摄像头状态
     */
    @GetMapping("/{channel}/status")
    @Operation(summary = "获取摄像头状态", description = "获取指定通道的运行状态和统计信息")
    public ResponseEntity<Map<String, Object>> getStatus(
            @Parameter(description = "通道号", required = true, example = "18")
            @PathVariable int channel) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("channel", channel);
        data.put("running", cameraManager.isRunning(channel));
        cameraManager.getStats(channel).ifPresent(stats -> data.put("stats", stats));
        return success(data);
    }

    // ================== 图像接口 ==================

    /**
     * 最新标注快照
     */
    @GetMapping("/{channel}/snapshot")
    @Operation(summary = "获取标注快照", description = "最近一次检测的标注图像（JPEG），尚无检测结果时返回 404")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "JPEG 图像",
                    content = @Content(mediaType = MediaType.IMAGE_JPEG_VALUE)),
            @ApiResponse(responseCode = "404", description = "通道未运行或尚无快照")
    })
    public ResponseEntity<byte[]> getSnapshot(
            @Parameter(description = "通道号", required = true, example = "18")
            @PathVariable int channel) {
        return jpeg(cameraManager.getSnapshot(channel));
    }

    /**
     * 最新原始帧
     */
    @GetMapping("/{channel}/frame")
    @Operation(summary = "获取原始帧", description = "最新解码帧（未标注，JPEG），尚未解码出帧时返回 404")
    public ResponseEntity<byte[]> getFrame(
            @Parameter(description = "通道号", required = true, example = "18")
            @PathVariable int channel) {
        return jpeg(cameraManager.getLatestFrame(channel));
    }

    // ================== 工具方法 ==================

    static ResponseEntity<byte[]> jpeg(Optional<byte[]> image) {
        return image
                .map(bytes -> ResponseEntity.ok()
                        .contentType(MediaType.IMAGE_JPEG)
                        .cacheControl(CacheControl.noStore())
                        .body(bytes))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private static ResponseEntity<Map<String, Object>> success(Object data) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        response.put("data", data);
        return ResponseEntity.ok(response);
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }
}
