package com.edge.counter.service;

import com.edge.counter.config.YamlConfig;
import com.edge.counter.core.camera.CameraSource;
import com.edge.counter.core.camera.CameraSourceFactory;
import com.edge.counter.core.camera.StreamState;
import com.edge.counter.core.camera.StreamWorker;
import com.edge.counter.core.infer.Detector;
import com.edge.counter.core.pool.PoolClosedException;
import com.edge.counter.core.pool.WorkerPool;
import com.edge.counter.core.render.DetectionPainter;
import com.edge.counter.exception.CameraAlreadyRunningException;
import com.edge.counter.exception.CameraException;
import com.edge.counter.exception.CameraNotFoundException;
import com.edge.counter.exception.InvalidChannelException;
import com.edge.counter.model.CameraStats;
import com.edge.counter.model.DetectionResult;
import com.edge.counter.util.ImageCodec;
import jakarta.annotation.PreDestroy;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 多路摄像头会话管理
 * <p>
 * 每个通道一个 {@link StreamWorker}，解码线程上完成节流、推理、统计和快照更新。
 * 注册表由 sessions 自身的监视器保护；启动等待和停止 join 都在锁外进行，
 * 一路慢摄像头不会阻塞其他通道的查询。
 */
@Service
public class CameraManager {
    private static final Logger logger = LoggerFactory.getLogger(CameraManager.class);

    private final Detector detector;
    private final CameraSourceFactory sourceFactory;
    private final WorkerPool workerPool;
    private final YamlConfig.CameraConfig cameraConfig;
    private final boolean offloadDetection;
    private final Clock clock;

    // channel -> session，按通道号排序
    private final Map<Integer, CameraSession> sessions = new TreeMap<>();

    public CameraManager(Detector detector,
                         CameraSourceFactory sourceFactory,
                         WorkerPool workerPool,
                         YamlConfig config,
                         Clock clock) {
        this.detector = detector;
        this.sourceFactory = sourceFactory;
        this.workerPool = workerPool;
        this.cameraConfig = config.getCameras();
        this.offloadDetection = config.getPool().isOffloadDetection();
        this.clock = clock;
        logger.info("CameraManager initialized - channels {}-{}, throttle {}ms, offload detection: {}",
                cameraConfig.getMinChannel(), cameraConfig.getMaxChannel(),
                cameraConfig.getThrottleMs(), offloadDetection);
    }

    /**
     * 启动指定通道
     *
     * @param channel 通道号
     * @param uri     视频源地址，为空时按 rtsp-url-template 生成
     * @return 启动后的统计快照（第一帧等待结束时的状态）
     * @throws InvalidChannelException        通道号越界
     * @throws CameraAlreadyRunningException 通道已存在（包括正在停止中）
     */
    public CameraStats start(int channel, String uri) {
        validateChannel(channel);
        String resolvedUri = (uri == null || uri.isBlank())
                ? String.format(cameraConfig.getRtspUrlTemplate(), channel)
                : uri.trim();

        CameraSession session;
        synchronized (sessions) {
            if (sessions.containsKey(channel)) {
                throw new CameraAlreadyRunningException(channel);
            }
            CameraSource source = sourceFactory.create(resolvedUri);
            StreamWorker worker = new StreamWorker("cam" + channel, source,
                    cameraConfig.getMaxEmptyReads(), cameraConfig.getEmptyReadBackoffMs());
            session = new CameraSession(channel, resolvedUri, worker, clock.millis());
            // 解码线程在锁内启动（非阻塞），stop 一旦看到会话就能 join 到它
            CameraSession started = session;
            worker.start(frame -> onFrame(started, frame));
            sessions.put(channel, session);
        }

        logger.info("Starting camera {}: {}", channel, resolvedUri);
        if (!detector.isReady()) {
            logger.warn("Detector not ready - camera {} will stream without detection", channel);
        }

        try {
            if (!session.getWorker().awaitFirstFrame(cameraConfig.getFirstFrameWaitMs())) {
                StreamState state = session.getWorker().getState();
                if (state == StreamState.FAILED) {
                    logger.warn("Camera {} failed to start: {}", channel,
                            session.getWorker().getFailure() != null ? session.getWorker().getFailure().getMessage() : "unknown");
                } else {
                    logger.info("Camera {} started, no frame within {}ms (state {})",
                            channel, cameraConfig.getFirstFrameWaitMs(), state);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        return session.toStats();
    }

    /**
     * 停止指定通道：锁内标记停止，锁外等待解码线程退出，再从注册表移除
     *
     * @throws CameraNotFoundException 通道不存在或已在停止中
     */
    public void stop(int channel) {
        CameraSession session;
        synchronized (sessions) {
            session = sessions.get(channel);
            if (session == null || session.isStopping()) {
                throw new CameraNotFoundException(channel);
            }
            session.markStopping();
        }

        logger.info("Stopping camera {}", channel);
        boolean exited = session.getWorker().stop(cameraConfig.getStopTimeoutMs());

        synchronized (sessions) {
            sessions.remove(channel, session);
        }

        if (exited) {
            session.release();
            logger.info("Camera {} stopped", channel);
        } else {
            logger.error("Camera {} decode thread did not exit, session removed anyway", channel);
        }
    }

    /**
     * 解码线程上的帧回调。帧在回调返回后由 StreamWorker 释放
     */
    void onFrame(CameraSession session, Mat frame) {
        session.incrementFrames();

        if (!detector.isReady()) {
            return;
        }
        if (offloadDetection && session.getDetectionInFlight().get()) {
            return;
        }
        if (!session.tryAcquireInferenceSlot(clock.millis(), cameraConfig.getThrottleMs())) {
            return;
        }

        if (!offloadDetection) {
            runDetection(session, frame);
            return;
        }

        session.getDetectionInFlight().set(true);
        Mat copy = frame.clone();
        try {
            workerPool.submit(() -> {
                try {
                    runDetection(session, copy);
                } finally {
                    copy.release();
                    session.getDetectionInFlight().set(false);
                }
            });
        } catch (PoolClosedException e) {
            copy.release();
            session.getDetectionInFlight().set(false);
            logger.debug("Worker pool closed, skipping detection for camera {}", session.getChannel());
        }
    }

    private void runDetection(CameraSession session, Mat frame) {
        try {
            DetectionResult result = detector.infer(frame);
            session.recordDetection(result);
            session.publishSnapshot(DetectionPainter.annotate(frame, result));
        } catch (RuntimeException e) {
            logger.error("Detection failed on camera {}: {}", session.getChannel(), e.getMessage(), e);
        }
    }

    /**
     * @return 最新标注快照的 JPEG，通道不存在或尚无快照时为空
     */
    public Optional<byte[]> getSnapshot(int channel) {
        CameraSession session = lookup(channel);
        if (session == null) {
            return Optional.empty();
        }
        return encode(session.copySnapshot());
    }

    /**
     * @return 最新原始帧的 JPEG，通道不存在或尚未解码出帧时为空
     */
    public Optional<byte[]> getLatestFrame(int channel) {
        CameraSession session = lookup(channel);
        if (session == null) {
            return Optional.empty();
        }
        return encode(session.getWorker().getLatestFrame());
    }

    private Optional<byte[]> encode(Mat image) {
        if (image == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(ImageCodec.toJpeg(image, cameraConfig.getJpegQuality()));
        } finally {
            image.release();
        }
    }

    public Optional<CameraStats> getStats(int channel) {
        CameraSession session = lookup(channel);
        return session == null ? Optional.empty() : Optional.of(session.toStats());
    }

    /**
     * @return 所有通道的统计，按通道号排序，在注册表锁内一次取齐
     */
    public List<CameraStats> getAllStats() {
        synchronized (sessions) {
            List<CameraStats> stats = new ArrayList<>(sessions.size());
            for (CameraSession session : sessions.values()) {
                stats.add(session.toStats());
            }
            return stats;
        }
    }

    public boolean isRunning(int channel) {
        CameraSession session = lookup(channel);
        return session != null && !session.isStopping() && session.getWorker().isRunning();
    }

    public int getActiveCount() {
        synchronized (sessions) {
            return sessions.size();
        }
    }

    private CameraSession lookup(int channel) {
        synchronized (sessions) {
            return sessions.get(channel);
        }
    }

    private void validateChannel(int channel) {
        if (channel < cameraConfig.getMinChannel() || channel > cameraConfig.getMaxChannel()) {
            throw new InvalidChannelException(channel, cameraConfig.getMinChannel(), cameraConfig.getMaxChannel());
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void autostart() {
        List<Integer> channels = cameraConfig.getAutostart();
        if (channels == null || channels.isEmpty()) {
            return;
        }
        logger.info("Auto-starting cameras: {}", channels);
        for (Integer channel : channels) {
            try {
                start(channel, null);
            } catch (CameraException e) {
                logger.error("Auto-start of camera {} failed: {}", channel, e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        List<CameraSession> toStop = new ArrayList<>();
        synchronized (sessions) {
            for (CameraSession session : sessions.values()) {
                if (!session.isStopping()) {
                    session.markStopping();
                    toStop.add(session);
                }
            }
        }

        if (!toStop.isEmpty()) {
            logger.info("Stopping {} camera(s)", toStop.size());
        }
        for (CameraSession session : toStop) {
            try {
                if (session.getWorker().stop(cameraConfig.getStopTimeoutMs())) {
                    session.release();
                }
            } catch (RuntimeException e) {
                logger.error("Error stopping camera {}: {}", session.getChannel(), e.getMessage(), e);
            }
        }

        synchronized (sessions) {
            sessions.clear();
        }
        logger.info("CameraManager shut down");
    }
}
