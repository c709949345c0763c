package com.edge.counter.controller;

import com.edge.counter.service.CameraManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 前端轮询用的快照地址，每次请求返回一张最新标注图
 */
@RestController
@RequestMapping("/stream")
@Tag(name = "快照流", description = "前端轮询的标注快照")
public class StreamController {

    @Autowired
    private CameraManager cameraManager;

    @GetMapping("/mjpeg/{channel}")
    @Operation(summary = "获取最新标注快照", description = "与 /api/camera/{channel}/snapshot 相同，尚无快照时返回 404")
    public ResponseEntity<byte[]> snapshot(
            @Parameter(description = "通道号", required = true, example = "18")
            @PathVariable int channel) {
        return CameraController.jpeg(cameraManager.getSnapshot(channel));
    }
}
