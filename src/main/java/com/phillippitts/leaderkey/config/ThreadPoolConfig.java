package com.phillippitts.leaderkey.config;

import com.phillippitts.leaderkey.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors used by the config store.
 *
 * <p>Pool settings come from {@link ThreadPoolProperties} ({@code leaderkey.threadpool.*}).
 * Both executors are single-threaded: file I/O never overlaps with itself, and every
 * mutation of the canonical tree happens on the one main thread.
 *
 * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
 * the worker thread to preserve request correlation IDs in async logs.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Single thread for reading, hashing and writing the config file.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the queue is full
     * the caller performs the I/O itself, providing backpressure instead of dropping a save.
     *
     * @return executor for config file I/O
     */
    @Bean(name = "configIoExecutor")
    public Executor configIoExecutor() {
        ThreadPoolProperties.PoolProperties ioProps = threadPoolProperties.getConfigIo();

        ThreadPoolTaskExecutor executor = singleThreadExecutor(ioProps);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Single thread owning the canonical tree. Load results and conflict prompts are
     * handed to this executor before shared state is touched.
     *
     * @return the main executor
     */
    @Bean(name = "mainExecutor")
    public Executor mainExecutor() {
        ThreadPoolTaskExecutor executor = singleThreadExecutor(threadPoolProperties.getMain());
        executor.initialize();
        return executor;
    }

    /**
     * Scheduler driving debounced saves. A pending save is cancelled and rescheduled on every edit.
     *
     * @return scheduler for the save debounce timer
     */
    @Bean(name = "configSaveScheduler")
    public TaskScheduler configSaveScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getScheduler();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(5);
        scheduler.setTaskDecorator(mdcPropagatingDecorator());
        scheduler.initialize();
        return scheduler;
    }

    private static ThreadPoolTaskExecutor singleThreadExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

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
