package com.example.careplan.journey.model;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

/**
 * Where a person stands in the product journey: completion fraction per product and the
 * flags raised so far.
 */
public record JourneySnapshot(Map<String, BigDecimal> progress, Set<String> flags) {

    public JourneySnapshot {
        progress = progress == null ? Map.of() : Map.copyOf(progress);
        flags = flags == null ? Set.of() : Set.copyOf(flags);
    }

    public BigDecimal progressOf(String product) {
        return progress.getOrDefault(product, BigDecimal.ZERO);
    }

    public boolean isComplete(String product) {
        return progressOf(product).compareTo(BigDecimal.ONE) >= 0;
    }
}
