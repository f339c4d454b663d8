package com.phillippitts.audio2video.service.metrics;

import com.phillippitts.audio2video.exception.ConversionErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics tracking for conversions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Conversion latency by outcome</li>
 *   <li>Success, failure (by error kind) and cancellation counts</li>
 *   <li>Jobs that ran without a known duration</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ConversionMetrics {

    private static final String METRIC_PREFIX = "audio2video";

    private final MeterRegistry registry;

    public ConversionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long one encode took.
     *
     * @param outcome succeeded, failed or cancelled
     * @param durationMillis wall-clock duration
     */
    public void recordLatency(String outcome, long durationMillis) {
        Timer.builder(METRIC_PREFIX + ".conversion.latency")
                .description("Time taken to convert one audio file")
                .tag("outcome", outcome)
                .register(registry)
                .record(durationMillis, TimeUnit.MILLISECONDS);
    }

    public void incrementSuccess() {
        Counter.builder(METRIC_PREFIX + ".conversion.success")
                .description("Number of completed conversions")
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for an error kind.
     *
     * @param kind failure classification, used as the {@code reason} tag
     */
    public void incrementFailure(ConversionErrorKind kind) {
        Counter.builder(METRIC_PREFIX + ".conversion.failure")
                .description("Number of failed conversions")
                .tag("reason", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void incrementCancelled() {
        Counter.builder(METRIC_PREFIX + ".conversion.cancelled")
                .description("Number of cancelled conversions")
                .register(registry)
                .increment();
    }

    public void incrementUnknownDuration() {
        Counter.builder(METRIC_PREFIX + ".probe.unknown")
                .description("Conversions that ran with indeterminate progress")
                .register(registry)
                .increment();
    }
}
