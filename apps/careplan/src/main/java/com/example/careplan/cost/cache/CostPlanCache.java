package com.example.careplan.cost.cache;

import com.example.careplan.cost.model.CostBreakdown;
import reactor.core.publisher.Mono;

/**
 * Time-boxed store of computed cost breakdowns, keyed by the full value of the query.
 */
public interface CostPlanCache {

    String CACHE_NAME = "cost-breakdown";

    Mono<CostBreakdown> get(String key);

    Mono<CostBreakdown> put(String key, CostBreakdown value);

    /**
     * Return the cached breakdown or compute and store it. Two concurrent misses for the same
     * key may both compute; both results are identical.
     */
    default Mono<CostBreakdown> getOrCompute(String key, Mono<CostBreakdown> supplier) {
        return get(key)
                .switchIfEmpty(Mono.defer(() -> supplier.flatMap(value -> put(key, value))));
    }

    Mono<Void> invalidate(String key);
}
