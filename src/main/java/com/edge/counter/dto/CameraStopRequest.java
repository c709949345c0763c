package com.edge.counter.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "停止摄像头请求")
public class CameraStopRequest {
    @Schema(description = "通道号", example = "18", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer channel;

    public Integer getChannel() { return channel; }
    public void setChannel(Integer channel) { this.channel = channel; }
}
