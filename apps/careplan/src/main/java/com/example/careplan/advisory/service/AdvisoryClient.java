package com.example.careplan.advisory.service;

import com.example.careplan.advisory.model.AdjudicationContext;
import com.example.careplan.advisory.model.AdvisoryOpinion;
import com.example.careplan.advisory.port.AdvisoryPort;
import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.observability.metrics.BusinessMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Calls the advisory port under a timeout. Every failure mode collapses to an empty result,
 * so callers only ever see "an opinion" or "no opinion".
 */
@Slf4j
@Service
public class AdvisoryClient {

    private final AdvisoryPort port;
    private final BusinessMetrics metrics;
    private final boolean enabled;
    private final Duration timeout;

    public AdvisoryClient(AdvisoryPort port, CarePlanProperties properties, BusinessMetrics metrics) {
        this.port = port;
        this.metrics = metrics;
        this.enabled = properties.getAdvisory().isEnabled();
        this.timeout = properties.getAdvisory().getTimeout();
        log.info("Advisory client initialized (enabled={}, timeout={})", enabled, timeout);
    }

    @NonNull
    public Mono<AdvisoryOpinion> advise(@NonNull AdjudicationContext context) {
        if (!enabled) {
            return Mono.empty();
        }
        long start = System.nanoTime();
        return Mono.defer(() -> port.advise(context))
                .timeout(timeout)
                .doOnNext(opinion -> metrics.recordAdvisoryReceived(Duration.ofNanos(System.nanoTime() - start)))
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Advisory returned no opinion");
                    metrics.recordAdvisoryEmpty();
                    return Mono.empty();
                }))
                .onErrorResume(e -> {
                    boolean timedOut = e instanceof TimeoutException;
                    log.warn("Advisory unavailable: {}", timedOut
                            ? "timed out after " + timeout
                            : e.getClass().getSimpleName() + ": " + e.getMessage());
                    metrics.recordAdvisoryFailure(timedOut);
                    return Mono.empty();
                });
    }
}
