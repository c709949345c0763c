package com.edge.counter.core.camera;

import com.edge.counter.config.NativeLibraryLoader;
import com.edge.counter.exception.DecodeException;
import com.edge.counter.exception.SourceOpenException;
import com.edge.counter.support.Await;
import com.edge.counter.support.FakeCameraSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.Mat;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class StreamWorkerTest {

    private StreamWorker worker;

    @BeforeAll
    static void loadOpenCv() {
        NativeLibraryLoader.loadNativeLibraries();
    }

    @AfterEach
    void tearDown() {
        if (worker != null) {
            worker.stop(2000);
        }
    }

    @Test
    void testStart_SourceFailsToOpen_EndsFailed() throws Exception {
        FakeCameraSource source = FakeCameraSource.unreachable();
        worker = new StreamWorker("t1", source, 3, 1);

        worker.start(frame -> fail("no frame expected"));

        assertFalse(worker.awaitFirstFrame(2000));
        Await.until(() -> worker.getState() == StreamState.FAILED, 2000, "worker should fail");
        assertTrue(worker.getFailure() instanceof SourceOpenException);
        assertFalse(worker.isRunning());
        assertNull(worker.getLatestFrame());
    }

    @Test
    void testDecodeLoop_EndOfStream_StopsAfterEmptyReads() throws Exception {
        FakeCameraSource source = FakeCameraSource.finite(12);
        AtomicInteger callbacks = new AtomicInteger();
        worker = new StreamWorker("t2", source, 3, 1);

        worker.start(frame -> callbacks.incrementAndGet());

        assertTrue(worker.awaitFirstFrame(2000));
        Await.until(() -> worker.getState() == StreamState.STOPPED, 3000, "stream should end");
        assertEquals(12, callbacks.get());
        assertEquals(12, worker.getDecodedFrames());
        assertEquals(1, source.getCloseCount());
        assertNull(worker.getFailure());
        assertFalse(worker.isRunning());
    }

    @Test
    void testDecodeLoop_ReadThrows_EndsFailedWithDecodeException() throws Exception {
        FakeCameraSource source = FakeCameraSource.finite(10).failAfter(4);
        AtomicInteger callbacks = new AtomicInteger();
        worker = new StreamWorker("t3", source, 3, 1);

        worker.start(frame -> callbacks.incrementAndGet());

        Await.until(() -> worker.getState() == StreamState.FAILED, 3000, "decode error should fail the stream");
        assertEquals(4, callbacks.get());
        assertTrue(worker.getFailure() instanceof DecodeException);
        assertEquals(1, source.getCloseCount());
    }

    @Test
    void testDecodeLoop_CallbackThrows_KeepsDecoding() throws Exception {
        FakeCameraSource source = FakeCameraSource.finite(6);
        AtomicInteger callbacks = new AtomicInteger();
        worker = new StreamWorker("t4", source, 3, 1);

        worker.start(frame -> {
            callbacks.incrementAndGet();
            throw new IllegalArgumentException("bad frame handler");
        });

        Await.until(() -> worker.getState() == StreamState.STOPPED, 3000, "stream should end normally");
        assertEquals(6, callbacks.get());
        assertNull(worker.getFailure());
    }

    @Test
    void testGetLatestFrame_ReturnsIndependentCopy() throws Exception {
        worker = new StreamWorker("t5", FakeCameraSource.finite(3), 3, 1);
        worker.start(frame -> { });
        Await.until(() -> worker.getState() == StreamState.STOPPED, 3000, "stream should end");

        Mat first = worker.getLatestFrame();
        Mat second = worker.getLatestFrame();
        try {
            assertNotNull(first);
            assertEquals(64, first.cols());
            assertEquals(48, first.rows());
            first.release();
            assertFalse(second.empty(), "releasing one copy must not affect another");
        } finally {
            second.release();
        }
    }

    @Test
    void testDimensions_SourceReportsNone_TakenFromFirstFrame() throws Exception {
        FakeCameraSource source = new FakeCameraSource("fake://nometa", true, 2, 32, 24, false);
        worker = new StreamWorker("t6", source, 3, 1);
        worker.start(frame -> { });

        assertTrue(worker.awaitFirstFrame(2000));
        assertEquals(32, worker.getWidth());
        assertEquals(24, worker.getHeight());
        assertEquals(0.0, worker.getFps());
    }

    @Test
    void testStart_Twice_Rejected() {
        worker = new StreamWorker("t7", FakeCameraSource.endless(), 3, 1);
        worker.start(frame -> { });

        assertThrows(IllegalStateException.class, () -> worker.start(frame -> { }));
    }

    @Test
    void testStop_EndlessStream_JoinsAndStops() throws Exception {
        FakeCameraSource source = FakeCameraSource.endless();
        worker = new StreamWorker("t8", source, 3, 1);
        worker.start(frame -> { });
        assertTrue(worker.awaitFirstFrame(2000));
        assertTrue(worker.isRunning());
        assertEquals(StreamState.STREAMING, worker.getState());

        assertTrue(worker.stop(2000));

        assertEquals(StreamState.STOPPED, worker.getState());
        assertFalse(worker.isRunning());
        assertNull(worker.getLatestFrame(), "latest frame is released on stop");
        assertEquals(1, source.getCloseCount());
    }

    @Test
    void testStop_NeverStarted_ReturnsImmediately() {
        worker = new StreamWorker("t9", FakeCameraSource.endless(), 3, 1);

        assertTrue(worker.stop(1000));
        assertEquals(StreamState.STOPPED, worker.getState());
    }

    @Test
    void testStart_OpenThrows_EndsFailedWithSourceOpenException() throws Exception {
        worker = new StreamWorker("t10", FakeCameraSource.throwingOnOpen(), 3, 1);

        worker.start(frame -> fail("no frame expected"));

        assertFalse(worker.awaitFirstFrame(2000));
        Await.until(() -> worker.getState() == StreamState.FAILED, 2000, "worker should fail");
        assertTrue(worker.getFailure() instanceof SourceOpenException);
        assertTrue(worker.getFailure().getCause() instanceof IllegalStateException);
    }

    @Test
    void testStop_StalledRead_GivesUpAfterTimeoutAndGrace() throws Exception {
        FakeCameraSource source = FakeCameraSource.stalled();
        worker = new StreamWorker("t11", source, 3, 1);
        worker.start(frame -> { });
        Await.until(() -> worker.getState() == StreamState.STREAMING, 2000, "worker should be streaming");

        long begin = System.currentTimeMillis();
        boolean exited = worker.stop(200);
        long elapsed = System.currentTimeMillis() - begin;

        assertFalse(exited);
        assertTrue(elapsed >= 200, "returned after " + elapsed + " ms");
        assertTrue(elapsed < 1500, "returned after " + elapsed + " ms");
        assertFalse(worker.isRunning());

        // 放行后解码线程自行退出
        source.unblock();
        Await.until(() -> source.getCloseCount() == 1, 2000, "source should be closed");
        assertEquals(StreamState.STOPPED, worker.getState());
    }
}
