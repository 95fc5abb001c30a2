package com.example.careplan.cost.cache;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.cost.model.CostBreakdown;
import com.example.careplan.observability.CacheMetricsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Redis-backed cost cache shared across instances.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "careplan.cache.store", havingValue = "redis")
public class RedisCostPlanCache implements CostPlanCache {

    private static final String KEY_PREFIX = "careplan:cost:";
    private static final String CACHE_TYPE = "redis";

    private final ReactiveRedisTemplate<String, CostBreakdown> redisTemplate;
    private final CacheMetricsService metricsService;
    private final Duration ttl;

    public RedisCostPlanCache(
            @Qualifier(CostCacheConfig.COST_CACHE_TEMPLATE) ReactiveRedisTemplate<String, CostBreakdown> redisTemplate,
            CarePlanProperties properties,
            CacheMetricsService metricsService) {
        this.redisTemplate = redisTemplate;
        this.metricsService = metricsService;
        this.ttl = properties.getCache().getCostTtl();
        log.info("Initialized Redis cost cache with TTL: {}", ttl);
    }

    @Override
    public Mono<CostBreakdown> get(String key) {
        return redisTemplate.opsForValue()
                .get(keyFor(key))
                .doOnNext(v -> {
                    log.debug("Cache hit in Redis for key: {}", key);
                    metricsService.recordHit(CACHE_NAME, CACHE_TYPE);
                })
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("Cache miss in Redis for key: {}", key);
                    metricsService.recordMiss(CACHE_NAME, CACHE_TYPE);
                    return Mono.empty();
                }));
    }

    @Override
    public Mono<CostBreakdown> put(String key, CostBreakdown value) {
        return redisTemplate.opsForValue()
                .set(keyFor(key), value, ttl)
                .thenReturn(value)
                .doOnSuccess(v -> log.debug("Cached value in Redis for key: {}", key));
    }

    @Override
    public Mono<Void> invalidate(String key) {
        return redisTemplate.delete(keyFor(key))
                .doOnSuccess(count -> log.debug("Invalidated cache in Redis for key: {}", key))
                .then();
    }

    private String keyFor(String key) {
        return KEY_PREFIX + key;
    }
}
