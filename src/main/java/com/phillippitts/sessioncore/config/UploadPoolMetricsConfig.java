package com.phillippitts.sessioncore.config;

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
 * Exposes the upload executor's pool state via Micrometer:
 * {@code sessioncore.upload.pool.size}, {@code .active}, {@code .queued} and {@code .completed}.
 *
 * <p>Also logs a one-line pool summary every 5 minutes while uploads are active.
 */
@Configuration
public class UploadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(UploadPoolMetricsConfig.class);
    private static final String PREFIX = "sessioncore.upload.pool";

    private final ObjectProvider<ThreadPoolTaskExecutor> uploadExecutorProvider;

    public UploadPoolMetricsConfig(
            @Qualifier("uploadExecutor") ObjectProvider<ThreadPoolTaskExecutor> uploadExecutorProvider) {
        this.uploadExecutorProvider = uploadExecutorProvider;
    }

    @Bean
    public MeterBinder uploadExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = uploadExecutorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder(PREFIX + ".size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the upload pool")
                    .register(registry);
            Gauge.builder(PREFIX + ".active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Threads currently reading or dispatching uploads")
                    .register(registry);
            Gauge.builder(PREFIX + ".queued", executor, e -> e.getQueue().size())
                    .description("Uploads waiting for a thread")
                    .register(registry);
            Gauge.builder(PREFIX + ".completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of upload tasks run")
                    .register(registry);
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logUploadPoolHealth() {
        ThreadPoolExecutor executor = uploadExecutorProvider.getObject().getThreadPoolExecutor();
        if (executor.getActiveCount() == 0 && executor.getQueue().isEmpty()) {
            return;
        }
        LOG.info("Upload pool: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
