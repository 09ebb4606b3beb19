package com.phillippitts.livetranslate.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for translation fan-out, delivery and session reaping.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Parallel translation phase latency and per-language fallbacks</li>
 *   <li>Listener delivery outcomes and attempts per delivery</li>
 *   <li>Sessions ended per reaper rule</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class LiveTranslateMetrics {

    private static final String METRIC_PREFIX = "livetranslate";

    private final MeterRegistry registry;

    public LiveTranslateMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the wall-clock duration of one parallel translation phase.
     */
    public void recordTranslationLatency(long durationMs, int languages) {
        Timer.builder(METRIC_PREFIX + ".translation.latency")
                .description("Wall-clock time of the parallel translation phase")
                .tag("languages", languages > 5 ? "6+" : String.valueOf(languages))
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Counts a language whose translation failed and fell back to the original text.
     */
    public void incrementTranslationFallback(String targetLanguage) {
        Counter.builder(METRIC_PREFIX + ".translation.fallback")
                .description("Translations replaced by the original text after a provider failure")
                .tag("language", targetLanguage)
                .register(registry)
                .increment();
    }

    public void incrementDeliverySuccess() {
        Counter.builder(METRIC_PREFIX + ".delivery.success")
                .description("Listener deliveries that reached the socket")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (retries_exhausted, unexpected_error)
     */
    public void incrementDeliveryFailure(String reason) {
        Counter.builder(METRIC_PREFIX + ".delivery.failure")
                .description("Listener deliveries abandoned")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDeliveryAttempts(int attempts) {
        DistributionSummary.builder(METRIC_PREFIX + ".delivery.attempts")
                .description("Send attempts used per listener delivery")
                .register(registry)
                .record(attempts);
    }

    public void incrementSessionsEnded(String rule, int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(METRIC_PREFIX + ".reaper.ended")
                .description("Sessions ended by the reaper")
                .tag("rule", rule)
                .register(registry)
                .increment(count);
    }
}
