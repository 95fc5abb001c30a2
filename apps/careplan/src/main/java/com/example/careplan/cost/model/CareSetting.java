package com.example.careplan.cost.model;

import com.example.careplan.gate.model.Tier;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Where care is delivered, which decides the base rate and the modifier table used.
 */
public enum CareSetting {
    ASSISTED_LIVING,
    MEMORY_CARE,
    MEMORY_CARE_HIGH_ACUITY,
    IN_HOME;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isFacility() {
        return this != IN_HOME;
    }

    /**
     * Facility setting matching a care tier. Tiers without a facility map to assisted living.
     */
    public static CareSetting facilityFor(Tier tier) {
        return switch (tier) {
            case MEMORY_CARE -> MEMORY_CARE;
            case MEMORY_CARE_HIGH_ACUITY -> MEMORY_CARE_HIGH_ACUITY;
            case ASSISTED_LIVING, IN_HOME, NO_CARE_NEEDED -> ASSISTED_LIVING;
        };
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static CareSetting fromCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Care setting is required");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(s -> s.code().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown care setting: " + code));
    }
}
