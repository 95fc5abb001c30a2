package com.example.careplan.cost.cache;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.cost.model.CostBreakdown;
import com.example.careplan.observability.CacheMetricsService;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Caffeine-backed cost cache for single-instance deployments.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "careplan.cache.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryCostPlanCache implements CostPlanCache {

    private static final String CACHE_TYPE = "memory";

    private final Cache<String, CostBreakdown> cache;
    private final CacheMetricsService metricsService;

    public InMemoryCostPlanCache(CarePlanProperties properties, CacheMetricsService metricsService) {
        this.metricsService = metricsService;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(properties.getCache().getCostTtl())
                .maximumSize(properties.getCache().getMaxEntries())
                .build();

        metricsService.registerSizeGauge(CACHE_NAME, CACHE_TYPE, cache::estimatedSize);
        log.info("Initialized in-memory cost cache with TTL: {}, max-entries={}",
                properties.getCache().getCostTtl(), properties.getCache().getMaxEntries());
    }

    @Override
    public Mono<CostBreakdown> get(String key) {
        return Mono.fromSupplier(() -> cache.getIfPresent(key))
                .doOnNext(v -> {
                    log.debug("Cache hit for key: {}", key);
                    metricsService.recordHit(CACHE_NAME, CACHE_TYPE);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Cache miss for key: {}", key);
                    metricsService.recordMiss(CACHE_NAME, CACHE_TYPE);
                    return Mono.empty();
                }));
    }

    @Override
    public Mono<CostBreakdown> put(String key, CostBreakdown value) {
        return Mono.fromSupplier(() -> {
            cache.put(key, value);
            log.debug("Cached value for key: {}", key);
            return value;
        });
    }

    @Override
    public Mono<Void> invalidate(String key) {
        return Mono.fromRunnable(() -> {
            cache.invalidate(key);
            log.debug("Invalidated cache for key: {}", key);
        });
    }
}
