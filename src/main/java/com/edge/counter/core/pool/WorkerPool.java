package com.edge.counter.core.pool;

import com.edge.counter.core.queue.TaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 固定大小的工作线程池
 * <p>
 * N 个常驻工作线程从 {@link TaskQueue} 中竞争取任务。每提交一个任务释放一个许可，
 * 工作线程拿到许可后弹出恰好一个任务执行。多个工作线程之间不保证 FIFO。
 * <p>
 * 任务抛出的异常由工作线程记录日志，工作线程本身不会退出；提交方通过返回的
 * {@link CompletableFuture} 拿到结果或异常。
 */
public class WorkerPool {
    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    // 强制中断后再等待的时间
    private static final long INTERRUPT_GRACE_MS = 500;

    @FunctionalInterface
    private interface PoolTask {
        void execute() throws Exception;
    }

    private final String name;
    private final TaskQueue<PoolTask> queue = new TaskQueue<>();
    private final Semaphore available = new Semaphore(0);
    private final List<Thread> workers;
    private final long shutdownTimeoutMs;

    // submit 持读锁，shutdown 持写锁：关闭之后不会再有任务入队
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();
    private volatile boolean stopping = false;

    public WorkerPool(String name, int workerCount, long shutdownTimeoutMs) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0, got " + workerCount);
        }
        this.name = name;
        this.shutdownTimeoutMs = shutdownTimeoutMs;

        List<Thread> threads = new ArrayList<>(workerCount);
        for (int i = 0; i < workerCount; i++) {
            final int workerId = i;
            Thread t = new Thread(() -> workerLoop(workerId), name + "-" + i);
            t.setDaemon(true);
            threads.add(t);
        }
        this.workers = Collections.unmodifiableList(threads);
        workers.forEach(Thread::start);

        logger.info("Worker pool '{}' started with {} threads", name, workerCount);
    }

    /**
     * 提交有返回值的任务
     *
     * @throws PoolClosedException 线程池已关闭，任务不会入队
     */
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> handle = new CompletableFuture<>();
        enqueue(() -> {
            try {
                handle.complete(task.call());
            } catch (Throwable t) {
                handle.completeExceptionally(t);
                throw t;
            }
        });
        return handle;
    }

    public CompletableFuture<Void> submit(Runnable task) {
        return submit(() -> {
            task.run();
            return null;
        });
    }

    private void enqueue(PoolTask task) {
        ReentrantReadWriteLock.ReadLock lock = lifecycleLock.readLock();
        lock.lock();
        try {
            if (stopping) {
                throw new PoolClosedException(name);
            }
            queue.push(task);
            available.release();
        } finally {
            lock.unlock();
        }
    }

    private void workerLoop(int workerId) {
        logger.debug("Worker {}-{} started", name, workerId);
        while (true) {
            try {
                available.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Worker {}-{} interrupted while idle, exiting", name, workerId);
                return;
            }

            PoolTask task = queue.pop();
            if (task == null) {
                if (stopping) {
                    logger.debug("Worker {}-{} stopping", name, workerId);
                    return;
                }
                continue;
            }

            try {
                task.execute();
            } catch (InterruptedException e) {
                if (stopping) {
                    logger.warn("Worker {}-{} interrupted during shutdown, exiting", name, workerId);
                    return;
                }
                logger.warn("Worker {}-{} task interrupted", name, workerId);
            } catch (Exception e) {
                logger.error("Worker {}-{} task failed: {}", name, workerId, e.getMessage(), e);
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                // Error 已经写入任务句柄，工作线程继续运行
                logger.error("Worker {}-{} task raised {}", name, workerId, t.toString(), t);
            }
        }
    }

    /**
     * 近似的待执行任务数
     */
    public int pending() {
        return queue.size();
    }

    public int size() {
        return workers.size();
    }

    public String getName() {
        return name;
    }

    public boolean isShutdown() {
        return stopping;
    }

    /**
     * 关闭线程池：拒绝新任务，已入队的任务会被执行完，然后等待所有工作线程退出。
     * 超过 shutdownTimeoutMs 仍未退出的线程会被中断；中断后仍不退出的线程被放弃（守护线程）。
     *
     * @return 所有工作线程是否都已退出
     */
    public boolean shutdown() {
        ReentrantReadWriteLock.WriteLock lock = lifecycleLock.writeLock();
        lock.lock();
        try {
            if (stopping) {
                return workers.stream().noneMatch(Thread::isAlive);
            }
            stopping = true;
            // 每个工作线程一个额外许可，用于唤醒
            available.release(workers.size());
        } finally {
            lock.unlock();
        }

        logger.info("Shutting down worker pool '{}'", name);
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(shutdownTimeoutMs);
        boolean allExited = true;

        for (Thread worker : workers) {
            if (!joinUntil(worker, deadline)) {
                logger.warn("Worker {} did not exit within {} ms, interrupting", worker.getName(), shutdownTimeoutMs);
                worker.interrupt();
                long graceDeadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(INTERRUPT_GRACE_MS);
                if (!joinUntil(worker, graceDeadline)) {
                    logger.error("Worker {} still running after interrupt, abandoning it", worker.getName());
                    allExited = false;
                }
            }
        }

        logger.info("Worker pool '{}' shutdown complete ({} tasks left)", name, queue.size());
        return allExited;
    }

    private static boolean joinUntil(Thread thread, long deadlineNanos) {
        long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        try {
            if (remainingMs > 0) {
                thread.join(remainingMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !thread.isAlive();
    }
}
