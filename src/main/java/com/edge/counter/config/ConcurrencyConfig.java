package com.edge.counter.config;

import com.edge.counter.core.pool.WorkerPool;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 线程池与时钟
 */
@Configuration
public class ConcurrencyConfig {

    @Bean(destroyMethod = "shutdown")
    public WorkerPool workerPool(YamlConfig config) {
        YamlConfig.PoolConfig pool = config.getPool();
        int workers = pool.getWorkers() > 0 ? pool.getWorkers() : Runtime.getRuntime().availableProcessors();
        return new WorkerPool("worker", workers, pool.getShutdownTimeoutMs());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
