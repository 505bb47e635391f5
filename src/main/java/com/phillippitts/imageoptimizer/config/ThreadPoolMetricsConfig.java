package com.phillippitts.imageoptimizer.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the batch executor's pool state via Micrometer.
 *
 * <ul>
 *   <li>batch.pool.size - current number of threads</li>
 *   <li>batch.pool.active - threads running an optimization call</li>
 *   <li>batch.pool.queued - calls waiting for a thread</li>
 *   <li>batch.pool.completed - cumulative completed calls</li>
 * </ul>
 *
 * <p>Also logs a pool summary every 5 minutes.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> batchExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("batchExecutor") ObjectProvider<ThreadPoolTaskExecutor> batchExecutorProvider) {
        this.batchExecutorProvider = batchExecutorProvider;
    }

    @Bean
    public MeterBinder batchExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = batchExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("batch.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the batch pool")
                    .register(registry);

            Gauge.builder("batch.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads running an optimization call")
                    .register(registry);

            Gauge.builder("batch.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of optimization calls waiting in the queue")
                    .register(registry);

            Gauge.builder("batch.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed optimization calls")
                    .register(registry);

            LOG.info("Batch thread pool metrics registered: batch.pool.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = batchExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Batch Thread Pool Health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
