package com.example.careplan.regional.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Immutable regional multiplier tables as loaded from configuration.
 *
 * @param zip              5-digit zip code entries
 * @param zip3             3-digit zip prefix entries
 * @param state            2-letter state code entries, upper case
 * @param defaultMultiplier national fallback
 * @param status           how loading went
 * @param skippedEntries   number of malformed entries ignored while loading
 */
public record RegionalCostTable(
        Map<String, RegionEntry> zip,
        Map<String, RegionEntry> zip3,
        Map<String, RegionEntry> state,
        BigDecimal defaultMultiplier,
        LoadStatus status,
        int skippedEntries
) {
    public RegionalCostTable {
        zip = Map.copyOf(zip);
        zip3 = Map.copyOf(zip3);
        state = Map.copyOf(state);
    }

    public static RegionalCostTable empty(LoadStatus status) {
        return new RegionalCostTable(Map.of(), Map.of(), Map.of(), BigDecimal.ONE, status, 0);
    }

    public record RegionEntry(BigDecimal multiplier, String name) {
    }

    public enum LoadStatus {
        LOADED,
        PARTIAL,
        MISSING,
        MALFORMED;

        public boolean isDegraded() {
            return this != LOADED;
        }
    }
}
