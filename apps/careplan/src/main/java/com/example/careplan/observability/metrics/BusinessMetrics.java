package com.example.careplan.observability.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Centralized service for recording business-specific metrics.
 * Uses bounded tag values to prevent high-cardinality metric explosion.
 */
@Component
public class BusinessMetrics {

    private static final String OUTCOME_SUCCESS = "success";
    private static final String OUTCOME_FAILURE = "failure";
    private static final String TAG_UNKNOWN = "unknown";
    private static final int MAX_TAG_LENGTH = 50;

    private final MeterRegistry registry;

    private final Counter carePlansComputed;
    private final Counter carePlansDegraded;

    private final Counter advisoryReceived;
    private final Counter advisoryEmpty;
    private final Counter advisoryTimeout;
    private final Counter advisoryFailure;
    private final Timer advisoryTimer;

    private final Counter costPlansComputed;
    private final Counter costPlansBlocked;

    public BusinessMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.carePlansComputed = Counter.builder("careplan.computed")
                .description("Care plans computed")
                .register(registry);

        this.carePlansDegraded = Counter.builder("careplan.degraded")
                .description("Care plans that fell back to the safe default tier")
                .register(registry);

        this.advisoryReceived = Counter.builder("advisory.call")
                .tag("outcome", "received")
                .description("Advisory calls that returned an opinion")
                .register(registry);

        this.advisoryEmpty = Counter.builder("advisory.call")
                .tag("outcome", "empty")
                .description("Advisory calls that returned no opinion")
                .register(registry);

        this.advisoryTimeout = Counter.builder("advisory.call")
                .tag("outcome", "timeout")
                .description("Advisory calls that timed out")
                .register(registry);

        this.advisoryFailure = Counter.builder("advisory.call")
                .tag("outcome", OUTCOME_FAILURE)
                .description("Advisory calls that failed")
                .register(registry);

        this.advisoryTimer = Timer.builder("advisory.call.duration")
                .description("Advisory call duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        this.costPlansComputed = Counter.builder("costplan.computed")
                .tag("outcome", OUTCOME_SUCCESS)
                .description("Cost plans computed")
                .register(registry);

        this.costPlansBlocked = Counter.builder("costplan.computed")
                .tag("outcome", "blocked")
                .description("Cost plans refused for degraded care plans")
                .register(registry);
    }

    public void recordCarePlan(boolean degraded) {
        carePlansComputed.increment();
        if (degraded) {
            carePlansDegraded.increment();
        }
    }

    public void recordAdjudication(@Nullable String source, @Nullable String reason) {
        registry.counter("adjudication.decision",
                Tags.of("source", sanitizeTag(source), "reason", sanitizeTag(reason)))
                .increment();
    }

    public void recordAdvisoryReceived(@NonNull Duration duration) {
        advisoryTimer.record(duration.toNanos(), TimeUnit.NANOSECONDS);
        advisoryReceived.increment();
    }

    public void recordAdvisoryEmpty() {
        advisoryEmpty.increment();
    }

    public void recordAdvisoryFailure(boolean timeout) {
        if (timeout) {
            advisoryTimeout.increment();
        } else {
            advisoryFailure.increment();
        }
    }

    public void recordRegionalPrecision(@Nullable String precision) {
        registry.counter("regional.resolution",
                Tags.of("precision", sanitizeTag(precision)))
                .increment();
    }

    public void recordCostPlan(@Nullable String scenario) {
        costPlansComputed.increment();
        registry.counter("costplan.computed.by_scenario",
                Tags.of("scenario", sanitizeTag(scenario)))
                .increment();
    }

    public void recordCostPlanBlocked() {
        costPlansBlocked.increment();
    }

    @NonNull
    private String sanitizeTag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return TAG_UNKNOWN;
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_-]", "_");
        if (sanitized.length() > MAX_TAG_LENGTH) {
            sanitized = sanitized.substring(0, MAX_TAG_LENGTH);
        }
        return sanitized.isBlank() ? TAG_UNKNOWN : sanitized;
    }
}
