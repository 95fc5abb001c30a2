package com.example.careplan.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Hit, miss and size meters for the cost breakdown caches, tagged by cache name and store.
 */
@Slf4j
@Service
public class CacheMetricsService {

    private static final String METRIC_PREFIX = "careplan.cache";
    private static final String TAG_CACHE_NAME = "cache";
    private static final String TAG_CACHE_TYPE = "type";

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> hitCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> missCounters = new ConcurrentHashMap<>();
    private final Set<String> sizeGauges = ConcurrentHashMap.newKeySet();

    public CacheMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("Cache metrics service initialized");
    }

    /**
     * Record a cache hit.
     */
    public void recordHit(String cacheName, String cacheType) {
        counter(hitCounters, "hits", "Number of cache hits", cacheName, cacheType).increment();
    }

    /**
     * Record a cache miss.
     */
    public void recordMiss(String cacheName, String cacheType) {
        counter(missCounters, "misses", "Number of cache misses", cacheName, cacheType).increment();
    }

    /**
     * Register a gauge reading the cache size on every scrape.
     */
    public void registerSizeGauge(String cacheName, String cacheType, Supplier<Number> sizeSupplier) {
        if (sizeGauges.add(cacheName + ":" + cacheType)) {
            Gauge.builder(METRIC_PREFIX + ".size", sizeSupplier)
                    .description("Estimated number of cache entries")
                    .tags(TAG_CACHE_NAME, cacheName, TAG_CACHE_TYPE, cacheType)
                    .register(meterRegistry);
            log.debug("Registered size gauge for cache: {}:{}", cacheName, cacheType);
        }
    }

    /**
     * Get the current hit rate for a cache (hits / (hits + misses)).
     */
    public double getHitRate(String cacheName, String cacheType) {
        String key = cacheName + ":" + cacheType;
        Counter hitCounter = hitCounters.get(key);
        Counter missCounter = missCounters.get(key);

        double hits = hitCounter == null ? 0 : hitCounter.count();
        double misses = missCounter == null ? 0 : missCounter.count();
        double total = hits + misses;

        return total > 0 ? hits / total : 0.0;
    }

    private Counter counter(ConcurrentHashMap<String, Counter> counters, String suffix, String description,
                            String cacheName, String cacheType) {
        return counters.computeIfAbsent(cacheName + ":" + cacheType, k ->
                Counter.builder(METRIC_PREFIX + "." + suffix)
                        .description(description)
                        .tags(TAG_CACHE_NAME, cacheName, TAG_CACHE_TYPE, cacheType)
                        .register(meterRegistry)
        );
    }
}
