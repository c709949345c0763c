package com.edge.counter.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 单路摄像头统计快照
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CameraStats {
    private int channel;
    private String uri;
    @JsonProperty("isRunning")
    private boolean running;
    private String state;
    private int width;
    private int height;
    private double fps;
    private long totalFrames;
    private int staffCount;
    private int customerCount;
    private double avgInferenceMs;
    private long startTimeMs;
}
