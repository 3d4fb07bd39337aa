package com.phillippitts.essaydefense.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for correlation, recovery and grading.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Correlation outcomes by resolution method (session id, conversation id, name, most recent)</li>
 *   <li>Grading parse method, including the neutral-multiplier fallback</li>
 *   <li>External call latency and outcome per service</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available through the actuator.
 */
@Component
public class DefenseMetrics {

    private static final String METRIC_PREFIX = "essaydefense";

    private final MeterRegistry registry;

    public DefenseMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Counts a correlation attempt.
     *
     * @param outcome correlation status (MATCHED, DUPLICATE_IGNORED, CONFLICT, NO_MATCH)
     * @param method  resolution method, or "none"
     * @param path    push (webhook) or pull (recovery)
     */
    public void recordCorrelation(String outcome, String method, String path) {
        Counter.builder(METRIC_PREFIX + ".correlation")
                .description("Transcript correlation attempts by outcome and method")
                .tag("outcome", outcome)
                .tag("method", method)
                .tag("path", path)
                .register(registry)
                .increment();
    }

    /**
     * Counts how a grading response was turned into a multiplier.
     *
     * @param method EXPLICIT, ELEMENT_MEAN or DEFAULT (parse failure)
     */
    public void recordGradingParse(String method) {
        Counter.builder(METRIC_PREFIX + ".grading.parse")
                .description("Grading responses by parse method")
                .tag("method", method)
                .register(registry)
                .increment();
    }

    /**
     * Records one external call, including all retries.
     *
     * @param service       external service name
     * @param outcome       SUCCESS, TIMEOUT or ERROR
     * @param durationNanos total duration in nanoseconds
     */
    public void recordExternalCall(String service, String outcome, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".external.call")
                .description("Outbound calls to voice provider and grading AI")
                .tag("service", service)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a recovery sweep outcome per examined submission.
     *
     * @param result RECOVERED, NOT_FOUND, IN_PROGRESS, FAILED or SKIPPED
     */
    public void recordRecovery(String result) {
        Counter.builder(METRIC_PREFIX + ".recovery")
                .description("Recovery sweep results per submission")
                .tag("result", result)
                .register(registry)
                .increment();
    }
}
