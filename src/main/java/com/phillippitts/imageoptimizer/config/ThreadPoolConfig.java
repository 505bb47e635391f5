package com.phillippitts.imageoptimizer.config;

import com.phillippitts.imageoptimizer.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for optimization calls, the startup warmup and cancellation timeouts.
 *
 * <p>Pool sizes come from {@link ThreadPoolProperties} ({@code threadpool.*}).
 */
@Configuration
@EnableAsync
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Executor that runs {@code optimizeImages} calls off the caller's thread.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue
     * are full the caller runs the batch itself, which applies backpressure instead of failing.
     *
     * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread is copied to the
     * worker so request correlation IDs survive into batch logs.
     *
     * @return executor for batch processing
     */
    @Bean(name = "batchExecutor")
    public ThreadPoolTaskExecutor batchExecutor() {
        return buildExecutor(threadPoolProperties.getBatch());
    }

    /**
     * Small executor for the one-off startup warmup so it never competes with caller batches
     * for a pool slot.
     */
    @Bean(name = "warmupExecutor")
    public ThreadPoolTaskExecutor warmupExecutor() {
        return buildExecutor(threadPoolProperties.getWarmup());
    }

    /**
     * Scheduler used for {@code CancellationToken.cancelAfter} timeouts and {@code @Scheduled}
     * housekeeping.
     */
    @Bean(name = "timeoutScheduler")
    public ThreadPoolTaskScheduler timeoutScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("timeout-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitting thread's ThreadContext onto the worker for the duration of the task
     * and restores the worker's previous context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
