package com.phillippitts.sessioncore.config;

import com.phillippitts.sessioncore.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateUploadExecutorWithDefaults() {
        ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
        ThreadPoolTaskExecutor executor = config.uploadExecutor();
        try {
            assertThat(executor.getCorePoolSize()).isEqualTo(2);
            assertThat(executor.getMaxPoolSize()).isEqualTo(4);
            assertThat(executor.getThreadNamePrefix()).isEqualTo("upload-pool-");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldHandleConcurrentUploads() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).uploadExecutor();
        int taskCount = 10;
        CountDownLatch latch = new CountDownLatch(taskCount);
        AtomicInteger completed = new AtomicInteger();
        try {
            for (int i = 0; i < taskCount; i++) {
                executor.execute(() -> {
                    completed.incrementAndGet();
                    latch.countDown();
                });
            }

            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(completed.get()).isEqualTo(taskCount);
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldPropagateThreadContextToUploadWorkers() throws InterruptedException {
        ThreadPoolTaskExecutor executor = new ThreadPoolConfig(new ThreadPoolProperties()).uploadExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);
        try {
            ThreadContext.put("requestId", "req-42");
            executor.execute(() -> {
                seen.set(ThreadContext.get("requestId"));
                done.countDown();
            });

            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen.get()).isEqualTo("req-42");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void shouldFireAckTimeoutsOnDedicatedScheduler() throws InterruptedException {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolConfig(new ThreadPoolProperties()).ackTimeoutScheduler();
        AtomicReference<String> thread = new AtomicReference<>();
        CountDownLatch fired = new CountDownLatch(1);
        try {
            scheduler.schedule(() -> {
                thread.set(Thread.currentThread().getName());
                fired.countDown();
            }, Instant.now().plusMillis(20));

            assertThat(fired.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(thread.get()).startsWith("ack-timeout-");
        } finally {
            scheduler.shutdown();
        }
    }
}
