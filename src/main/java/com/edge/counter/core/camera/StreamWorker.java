package com.edge.counter.core.camera;

import com.edge.counter.exception.DecodeException;
import com.edge.counter.exception.SourceOpenException;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 单路摄像头解码线程
 * <p>
 * {@link #start(FrameCallback)} 启动一个解码线程：打开视频源，循环读取帧，
 * 将最新原始帧保存到单槽缓冲区，然后在解码线程上同步调用回调。
 * 回调的耗时直接决定解码吞吐。
 * <p>
 * 不做自动重连：流结束或出错后状态停留在 STOPPED / FAILED，由调用方轮询
 * {@link #isRunning()} 决定是否重启。
 */
public class StreamWorker {
    private static final Logger logger = LoggerFactory.getLogger(StreamWorker.class);

    // 强制中断后再等待的时间
    private static final long INTERRUPT_GRACE_MS = 500;

    private final String name;
    private final CameraSource source;
    private final int maxEmptyReads;
    private final long emptyReadBackoffMs;

    private final AtomicReference<StreamState> state = new AtomicReference<>(StreamState.IDLE);
    private final CountDownLatch firstFrame = new CountDownLatch(1);
    private final AtomicLong decodedFrames = new AtomicLong();

    private volatile boolean stopRequested = false;
    private volatile Thread decodeThread;
    private volatile Throwable failure;

    private volatile int width;
    private volatile int height;
    private volatile double fps;

    // 最新原始帧，frameLock 保护
    private final Object frameLock = new Object();
    private Mat latestFrame;

    public StreamWorker(String name, CameraSource source, int maxEmptyReads, long emptyReadBackoffMs) {
        this.name = name;
        this.source = source;
        this.maxEmptyReads = maxEmptyReads;
        this.emptyReadBackoffMs = emptyReadBackoffMs;
    }

    /**
     * 启动解码线程（非阻塞）
     *
     * @throws IllegalStateException 已经启动过
     */
    public void start(FrameCallback callback) {
        if (!state.compareAndSet(StreamState.IDLE, StreamState.OPENING)) {
            throw new IllegalStateException("Stream worker " + name + " already started (state " + state.get() + ")");
        }

        logger.info("Starting stream worker {} for {}", name, source.describe());
        Thread t = new Thread(() -> decodeLoop(callback), "decode-" + name);
        t.setDaemon(true);
        decodeThread = t;
        t.start();
    }

    private void decodeLoop(FrameCallback callback) {
        StreamState endState = StreamState.STOPPED;
        long frameCount = 0;

        try {
            boolean opened;
            try {
                opened = source.open();
            } catch (RuntimeException e) {
                fail(new SourceOpenException(source.describe(), e));
                return;
            }
            if (!opened) {
                fail(new SourceOpenException(source.describe()));
                return;
            }

            width = source.getWidth();
            height = source.getHeight();
            fps = source.getFps();

            state.set(StreamState.STREAMING);
            logger.info("Stream {} opened: {}x{} @ {} FPS", name, width, height, String.format("%.2f", fps));

            int emptyReads = 0;
            while (!stopRequested && !Thread.currentThread().isInterrupted()) {
                Mat frame = source.read();

                if (frame == null) {
                    emptyReads++;
                    if (emptyReads >= maxEmptyReads) {
                        logger.info("Stream {} ended after {} empty reads", name, emptyReads);
                        break;
                    }
                    Thread.sleep(emptyReadBackoffMs);
                    continue;
                }
                emptyReads = 0;

                try {
                    frameCount++;
                    decodedFrames.incrementAndGet();
                    if (width <= 0 || height <= 0) {
                        width = frame.cols();
                        height = frame.rows();
                    }

                    Mat copy = frame.clone();
                    Mat old;
                    synchronized (frameLock) {
                        old = latestFrame;
                        latestFrame = copy;
                    }
                    if (old != null) {
                        old.release();
                    }
                    firstFrame.countDown();

                    try {
                        callback.onFrame(frame);
                    } catch (RuntimeException e) {
                        logger.error("Frame callback failed on stream {}: {}", name, e.getMessage(), e);
                    }
                } finally {
                    frame.release();
                }
            }
        } catch (InterruptedException e) {
            logger.info("Stream {} interrupted", name);
        } catch (DecodeException e) {
            logger.error("Stream {} decode error: {}", name, e.getMessage(), e);
            failure = e;
            endState = StreamState.FAILED;
        } catch (RuntimeException e) {
            logger.error("Exception in decode loop of stream {}: {}", name, e.getMessage(), e);
            failure = new DecodeException("Decode loop failed: " + e.getMessage(), e);
            endState = StreamState.FAILED;
        } finally {
            try {
                source.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing source of stream {}: {}", name, e.getMessage());
            }
            if (state.get() != StreamState.FAILED) {
                state.set(endState);
            }
            firstFrame.countDown();
            logger.info("Decode loop of stream {} stopped ({} frames, state {})", name, frameCount, state.get());
        }
    }

    private void fail(Throwable cause) {
        logger.error("Stream {}: {}", name, cause.getMessage());
        failure = cause;
        state.set(StreamState.FAILED);
    }

    /**
     * 等待第一帧，流打开失败或结束时提前返回
     *
     * @return 是否已经收到第一帧
     */
    public boolean awaitFirstFrame(long timeoutMs) throws InterruptedException {
        firstFrame.await(timeoutMs, TimeUnit.MILLISECONDS);
        return decodedFrames.get() > 0;
    }

    /**
     * 请求停止并等待解码线程退出。
     * 超时后中断线程；中断后仍未退出则放弃等待（守护线程，不阻止进程退出）。
     *
     * @return 解码线程是否已退出
     */
    public boolean stop(long timeoutMs) {
        stopRequested = true;
        Thread t = decodeThread;

        if (t == null) {
            state.compareAndSet(StreamState.IDLE, StreamState.STOPPED);
            return true;
        }
        if (t == Thread.currentThread()) {
            // 在回调中调用 stop，不能 join 自己
            return false;
        }

        logger.info("Stopping stream worker {}", name);
        try {
            t.join(timeoutMs);
            if (t.isAlive()) {
                logger.warn("Stream {} did not stop within {} ms, interrupting", name, timeoutMs);
                t.interrupt();
                t.join(INTERRUPT_GRACE_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        if (t.isAlive()) {
            logger.error("Stream {} is stalled, abandoning decode thread", name);
            return false;
        }

        releaseLatestFrame();
        logger.info("Stream worker {} stopped", name);
        return true;
    }

    private void releaseLatestFrame() {
        Mat old;
        synchronized (frameLock) {
            old = latestFrame;
            latestFrame = null;
        }
        if (old != null) {
            old.release();
        }
    }

    /**
     * 获取最新原始帧的副本（需要由调用方释放）
     *
     * @return 副本，尚未解码出任何帧时返回 null
     */
    public Mat getLatestFrame() {
        synchronized (frameLock) {
            if (latestFrame == null || latestFrame.empty()) {
                return null;
            }
            return latestFrame.clone();
        }
    }

    public boolean isRunning() {
        return state.get().isActive() && !stopRequested;
    }

    public StreamState getState() {
        return state.get();
    }

    public Throwable getFailure() {
        return failure;
    }

    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public double getFps() { return fps; }
    public long getDecodedFrames() { return decodedFrames.get(); }
    public String getName() { return name; }
}
