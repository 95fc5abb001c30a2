package com.example.careplan.gate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse cognition classification used by the gates. Declaration order is severity order.
 */
public enum CognitionBand {
    NONE,
    MILD,
    MODERATE,
    SEVERE;

    public boolean atLeast(CognitionBand other) {
        return compareTo(other) >= 0;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
