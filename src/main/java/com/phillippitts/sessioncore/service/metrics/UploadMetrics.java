package com.phillippitts.sessioncore.service.metrics;

import com.phillippitts.sessioncore.exception.UploadRejectedException;
import com.phillippitts.sessioncore.service.upload.AckStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for uploads.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Acknowledgment outcomes (acknowledged, rejected, timeout, transport failure)</li>
 *   <li>Time from dispatch to outcome, per outcome</li>
 *   <li>Caller-side rejections per reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/metrics.
 */
@Component
public class UploadMetrics {

    private static final String METRIC_PREFIX = "sessioncore.upload";

    private final MeterRegistry registry;

    public UploadMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records a terminal acknowledgment outcome and how long it took.
     *
     * @param status outcome
     * @param durationNanos time from dispatch to outcome
     */
    public void recordOutcome(AckStatus status, long durationNanos) {
        String tag = tagValue(status);
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of uploads per acknowledgment outcome")
                .tag("status", tag)
                .register(registry)
                .increment();
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time from dispatch to acknowledgment outcome")
                .tag("status", tag)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Increments the rejection counter for a caller-side validation failure.
     *
     * @param reason why the upload was rejected
     */
    public void incrementRejected(UploadRejectedException.Reason reason) {
        Counter.builder(METRIC_PREFIX + ".rejected")
                .description("Number of uploads rejected before dispatch")
                .tag("reason", tagValue(reason))
                .register(registry)
                .increment();
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
