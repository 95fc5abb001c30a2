package com.example.careplan.cost.indicator;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.cost.cache.CostPlanCache;
import com.example.careplan.observability.CacheMetricsService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports the cost cache store and its hit rate via /actuator/health/costCache.
 * The cache only saves recomputation, so it never reports DOWN.
 */
@Component("costCacheHealthIndicator")
public class CostCacheHealthIndicator implements ReactiveHealthIndicator {

    private final CacheMetricsService metricsService;
    private final String store;
    private final String cacheType;

    public CostCacheHealthIndicator(CacheMetricsService metricsService, CarePlanProperties properties) {
        this.metricsService = metricsService;
        this.store = properties.getCache().getStore();
        this.cacheType = "redis".equals(store) ? "redis" : "memory";
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromSupplier(() -> Health.up()
                .withDetail("store", store)
                .withDetail("hitRate", metricsService.getHitRate(CostPlanCache.CACHE_NAME, cacheType))
                .build());
    }
}
