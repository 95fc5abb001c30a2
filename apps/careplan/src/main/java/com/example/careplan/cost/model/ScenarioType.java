package com.example.careplan.cost.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ScenarioType {
    FACILITY,
    IN_HOME;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
