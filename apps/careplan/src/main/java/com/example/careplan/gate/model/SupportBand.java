package com.example.careplan.gate.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse daily-support classification derived from hours of help and ADL/IADL needs.
 */
public enum SupportBand {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
