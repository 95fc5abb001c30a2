package com.example.careplan.adjudication.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DecisionSource {
    DETERMINISTIC,
    ADVISORY,
    /** Neither input produced a usable tier. */
    SAFE_DEFAULT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
