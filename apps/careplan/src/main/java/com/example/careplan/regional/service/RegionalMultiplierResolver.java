package com.example.careplan.regional.service;

import com.example.careplan.common.util.StringSanitizer;
import com.example.careplan.observability.metrics.BusinessMetrics;
import com.example.careplan.regional.model.RegionPrecision;
import com.example.careplan.regional.model.RegionalCostTable;
import com.example.careplan.regional.model.RegionalCostTable.RegionEntry;
import com.example.careplan.regional.model.RegionalMultiplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Resolves a cost multiplier by zip, zip prefix, state and national default, in that order.
 * The first level with an entry wins; values are never blended across levels.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RegionalMultiplierResolver {

    private static final Pattern ZIP_PATTERN = Pattern.compile("^\\d{5}(-\\d{4})?$");
    private static final Pattern STATE_PATTERN = Pattern.compile("^[A-Za-z]{2}$");

    private final RegionalCostTable table;
    private final BusinessMetrics metrics;

    @NonNull
    public RegionalMultiplier resolve(@Nullable String zip, @Nullable String state) {
        RegionalMultiplier resolved = lookup(normalizeZip(zip), normalizeState(state));
        metrics.recordRegionalPrecision(resolved.precision().code());
        log.debug("Regional multiplier: zip={}, state={} -> {} ({}, {})",
                StringSanitizer.forLog(zip, 10), StringSanitizer.forLog(state, 4),
                resolved.multiplier(), resolved.precision().code(), resolved.regionName());
        return resolved;
    }

    /**
     * State codes with their display names, sorted by code.
     */
    @NonNull
    public Map<String, String> listStates() {
        Map<String, String> states = new TreeMap<>();
        table.state().forEach((code, entry) -> states.put(code, entry.name() != null ? entry.name() : code));
        return states;
    }

    private RegionalMultiplier lookup(@Nullable String zip, @Nullable String state) {
        if (zip != null) {
            RegionEntry entry = table.zip().get(zip);
            if (entry != null) {
                return new RegionalMultiplier(entry.multiplier(), nameOr(entry, zip), RegionPrecision.ZIP);
            }
            String prefix = zip.substring(0, 3);
            entry = table.zip3().get(prefix);
            if (entry != null) {
                return new RegionalMultiplier(entry.multiplier(), nameOr(entry, "Region " + prefix), RegionPrecision.ZIP3);
            }
        }
        if (state != null) {
            RegionEntry entry = table.state().get(state);
            if (entry != null) {
                return new RegionalMultiplier(entry.multiplier(), nameOr(entry, state), RegionPrecision.STATE);
            }
        }
        return RegionalMultiplier.national(table.defaultMultiplier());
    }

    @Nullable
    private String normalizeZip(@Nullable String zip) {
        if (zip == null || zip.isBlank()) {
            return null;
        }
        String trimmed = zip.trim();
        if (!ZIP_PATTERN.matcher(trimmed).matches()) {
            log.debug("Ignoring malformed zip code: {}", StringSanitizer.forLog(zip, 16));
            return null;
        }
        return trimmed.substring(0, 5);
    }

    @Nullable
    private String normalizeState(@Nullable String state) {
        if (state == null || state.isBlank()) {
            return null;
        }
        String trimmed = state.trim();
        if (!STATE_PATTERN.matcher(trimmed).matches()) {
            log.debug("Ignoring malformed state code: {}", StringSanitizer.forLog(state, 16));
            return null;
        }
        return trimmed.toUpperCase(Locale.ROOT);
    }

    private static String nameOr(RegionEntry entry, String fallback) {
        return entry.name() != null ? entry.name() : fallback;
    }
}
