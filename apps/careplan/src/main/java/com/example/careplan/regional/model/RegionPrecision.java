package com.example.careplan.regional.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Geographic level a multiplier was resolved at, most specific first.
 */
public enum RegionPrecision {
    ZIP,
    ZIP3,
    STATE,
    NATIONAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
