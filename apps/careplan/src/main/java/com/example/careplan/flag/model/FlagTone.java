package com.example.careplan.flag.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum FlagTone {
    INFO,
    WARNING,
    CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
