package com.example.careplan.regional.service;

import com.example.careplan.regional.model.RegionalCostTable;
import com.example.careplan.regional.model.RegionalCostTable.LoadStatus;
import com.example.careplan.regional.model.RegionalCostTable.RegionEntry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the regional cost JSON file. Never throws: a missing or unreadable file yields an
 * empty table and malformed entries are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RegionalCostTableLoader {

    static final String ZIP_KEY = "zip_multipliers";
    static final String ZIP3_KEY = "zip3_multipliers";
    static final String STATE_KEY = "state_multipliers";
    static final String DEFAULT_KEY = "default_multiplier";

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @NonNull
    public RegionalCostTable load(@NonNull String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Regional cost config not found at {}, using national default only", location);
            return RegionalCostTable.empty(LoadStatus.MISSING);
        }

        JsonNode root;
        try (InputStream in = resource.getInputStream()) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            log.warn("Regional cost config at {} could not be parsed: {}", location, e.getMessage());
            return RegionalCostTable.empty(LoadStatus.MALFORMED);
        }
        if (root == null || !root.isObject()) {
            log.warn("Regional cost config at {} is not a JSON object", location);
            return RegionalCostTable.empty(LoadStatus.MALFORMED);
        }

        int[] skipped = {0};
        Map<String, RegionEntry> zip = entries(root, ZIP_KEY, false, skipped);
        Map<String, RegionEntry> zip3 = entries(root, ZIP3_KEY, false, skipped);
        Map<String, RegionEntry> state = entries(root, STATE_KEY, true, skipped);
        BigDecimal defaultMultiplier = defaultMultiplier(root, skipped);

        LoadStatus status = skipped[0] == 0 ? LoadStatus.LOADED : LoadStatus.PARTIAL;
        log.info("Regional cost config loaded from {}: zip={}, zip3={}, state={}, default={}, skipped={}",
                location, zip.size(), zip3.size(), state.size(), defaultMultiplier, skipped[0]);
        return new RegionalCostTable(zip, zip3, state, defaultMultiplier, status, skipped[0]);
    }

    private Map<String, RegionEntry> entries(JsonNode root, String key, boolean upperCaseKeys, int[] skipped) {
        Map<String, RegionEntry> result = new HashMap<>();
        JsonNode section = root.get(key);
        if (section == null || section.isNull()) {
            return result;
        }
        if (!section.isObject()) {
            log.warn("Regional cost config section '{}' is not an object, ignoring it", key);
            skipped[0]++;
            return result;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = section.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String code = upperCaseKeys ? field.getKey().toUpperCase(Locale.ROOT) : field.getKey();
            JsonNode multiplier = field.getValue().get("multiplier");
            if (multiplier == null || !multiplier.isNumber() || multiplier.decimalValue().signum() <= 0) {
                log.warn("Skipping malformed regional entry {}.{}", key, field.getKey());
                skipped[0]++;
                continue;
            }
            JsonNode name = field.getValue().get("name");
            result.put(code, new RegionEntry(
                    multiplier.decimalValue(),
                    name != null && name.isTextual() ? name.asText() : null));
        }
        return result;
    }

    private BigDecimal defaultMultiplier(JsonNode root, int[] skipped) {
        JsonNode node = root.get(DEFAULT_KEY);
        if (node == null || node.isNull()) {
            return BigDecimal.ONE;
        }
        if (!node.isNumber() || node.decimalValue().signum() <= 0) {
            log.warn("Ignoring malformed {}: {}", DEFAULT_KEY, node);
            skipped[0]++;
            return BigDecimal.ONE;
        }
        return node.decimalValue();
    }
}
