package com.phillippitts.sessioncore.config;

import com.phillippitts.sessioncore.config.logging.MdcTaskDecorator;
import com.phillippitts.sessioncore.config.properties.ThreadPoolProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools used by the upload pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates a bounded thread pool for upload work (file read, base64 encode, dispatch).
     *
     * <p>Pool sizing strategy configured via {@code threadpool.upload.*} properties:
     * <ul>
     *   <li>Core pool: default 2 - uploads are mostly waiting on the backend</li>
     *   <li>Max pool: default 4 - handles a multi-file drop</li>
     *   <li>Queue: default 50 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the submitting thread to the worker.
     *
     * @return Configured executor for uploads
     */
    @Bean(name = "uploadExecutor")
    public ThreadPoolTaskExecutor uploadExecutor() {
        ThreadPoolProperties.UploadPoolProperties props = threadPoolProperties.getUpload();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Creates the scheduler that fires acknowledgment timeouts.
     *
     * <p>Timeout tasks only perform a map removal and a future completion, so a single thread
     * is enough. Pending timeouts are discarded on shutdown; the process is going away and so are
     * the awaiting callers. ThreadContext is carried by {@code AckCoordinator}, which decorates each
     * timeout task itself.
     *
     * @return Configured scheduler for acknowledgment timeouts
     */
    @Bean(name = "ackTimeoutScheduler")
    public ThreadPoolTaskScheduler ackTimeoutScheduler() {
        ThreadPoolProperties.SchedulerProperties props = threadPoolProperties.getAckTimeout();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getPoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }
}
