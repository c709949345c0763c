package com.edge.counter.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 启动摄像头请求
 */
@Schema(description = "启动摄像头请求")
public class CameraStartRequest {
    @Schema(description = "通道号", example = "18", requiredMode = Schema.RequiredMode.REQUIRED)
    private Integer channel;

    @Schema(description = "视频源地址，为空时按通道号生成 RTSP 地址", example = "rtsp://192.168.1.10:554/unicast/c18/s0/live")
    private String url;

    public Integer getChannel() { return channel; }
    public void setChannel(Integer channel) { this.channel = channel; }

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
}
