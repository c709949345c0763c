package com.edge.counter.service;

import com.edge.counter.core.camera.StreamWorker;
import com.edge.counter.model.CameraStats;
import com.edge.counter.model.DetectionResult;
import org.opencv.core.Mat;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 单路摄像头的运行时状态：解码线程 + 快照缓冲 + 统计
 * <p>
 * 统计字段只由本会话的解码线程（或它提交的推理任务）写入；
 * 快照缓冲由 snapshotLock 保护，锁只包住一次读或写。
 */
class CameraSession {
    static final long NEVER = -1L;

    private final int channel;
    private final String uri;
    private final StreamWorker worker;
    private final long startTimeMs;

    private final AtomicLong totalFrames = new AtomicLong();
    private final AtomicBoolean detectionInFlight = new AtomicBoolean(false);
    private volatile long lastInferenceTime = NEVER;
    private volatile boolean stopping = false;

    // 检测统计，statsLock 保护
    private final Object statsLock = new Object();
    private int staffCount;
    private int customerCount;
    private double avgInferenceMs;

    private final Object snapshotLock = new Object();
    private Mat snapshot;
    private boolean released = false;

    CameraSession(int channel, String uri, StreamWorker worker, long startTimeMs) {
        this.channel = channel;
        this.uri = uri;
        this.worker = worker;
        this.startTimeMs = startTimeMs;
    }

    long incrementFrames() {
        return totalFrames.incrementAndGet();
    }

    /**
     * 节流判断：距离上次推理不足 throttleMs 返回 false；否则记录本次时间并返回 true
     */
    boolean tryAcquireInferenceSlot(long now, long throttleMs) {
        long last = lastInferenceTime;
        if (last != NEVER && now - last < throttleMs) {
            return false;
        }
        lastInferenceTime = now;
        return true;
    }

    /**
     * 记录一次推理结果，平均耗时用 EWMA (0.9 / 0.1) 平滑
     */
    void recordDetection(DetectionResult result) {
        synchronized (statsLock) {
            staffCount = result.getStaffCount();
            customerCount = result.getCustomerCount();
            double latency = result.getElapsedMs();
            if (avgInferenceMs == 0.0) {
                avgInferenceMs = latency;
            } else {
                avgInferenceMs = 0.9 * avgInferenceMs + 0.1 * latency;
            }
        }
    }

    /**
     * 替换快照，接管 annotated 的所有权。会话释放后到达的快照直接丢弃
     */
    void publishSnapshot(Mat annotated) {
        Mat old;
        synchronized (snapshotLock) {
            if (released) {
                old = annotated;
            } else {
                old = snapshot;
                snapshot = annotated;
            }
        }
        if (old != null) {
            old.release();
        }
    }

    /**
     * @return 快照副本（由调用方释放），尚无快照时返回 null
     */
    Mat copySnapshot() {
        synchronized (snapshotLock) {
            return snapshot != null ? snapshot.clone() : null;
        }
    }

    CameraStats toStats() {
        CameraStats.CameraStatsBuilder builder = CameraStats.builder()
                .channel(channel)
                .uri(uri)
                .running(worker.isRunning())
                .state(worker.getState().name())
                .width(worker.getWidth())
                .height(worker.getHeight())
                .fps(worker.getFps())
                .totalFrames(totalFrames.get())
                .startTimeMs(startTimeMs);
        synchronized (statsLock) {
            builder.staffCount(staffCount)
                    .customerCount(customerCount)
                    .avgInferenceMs(avgInferenceMs);
        }
        return builder.build();
    }

    void release() {
        Mat old;
        synchronized (snapshotLock) {
            released = true;
            old = snapshot;
            snapshot = null;
        }
        if (old != null) {
            old.release();
        }
    }

    int getChannel() { return channel; }
    String getUri() { return uri; }
    StreamWorker getWorker() { return worker; }
    AtomicBoolean getDetectionInFlight() { return detectionInFlight; }

    boolean isStopping() { return stopping; }
    void markStopping() { stopping = true; }
}
