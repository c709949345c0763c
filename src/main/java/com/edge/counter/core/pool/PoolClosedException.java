package com.edge.counter.core.pool;

import java.util.concurrent.RejectedExecutionException;

/**
 * 线程池已关闭后提交任务
 */
public class PoolClosedException extends RejectedExecutionException {

    public PoolClosedException(String poolName) {
        super("Worker pool '" + poolName + "' is shut down");
    }
}
