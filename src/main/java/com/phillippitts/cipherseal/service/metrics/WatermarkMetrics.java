package com.phillippitts.cipherseal.service.metrics;

import com.phillippitts.cipherseal.domain.MediaType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for watermark operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Embed/detect latency per media type</li>
 *   <li>Outcome counts (embedded, insufficient_capacity, detected, not_detected, ...)</li>
 *   <li>Failure counts by reason</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class WatermarkMetrics {

    private static final String METRIC_PREFIX = "cipherseal.watermark";

    private final MeterRegistry registry;

    public WatermarkMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records latency of one operation.
     *
     * @param mediaType     image or text
     * @param operation     "embed" or "detect"
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(MediaType mediaType, String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to embed or detect a watermark")
                .tag("media", mediaType.tag())
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts an expected outcome.
     *
     * @param mediaType image or text
     * @param operation "embed" or "detect"
     * @param outcome   lowercase outcome name (e.g., "embedded", "not_detected")
     */
    public void incrementOutcome(MediaType mediaType, String operation, String outcome) {
        Counter.builder(METRIC_PREFIX + ".outcome")
                .description("Number of watermark operations by outcome")
                .tag("media", mediaType.tag())
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    /**
     * Counts an operation that ended in an exception.
     *
     * @param mediaType image or text
     * @param operation "embed" or "detect"
     * @param reason    exception simple name or short reason
     */
    public void incrementFailure(MediaType mediaType, String operation, String reason) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed watermark operations")
                .tag("media", mediaType.tag())
                .tag("operation", operation)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
