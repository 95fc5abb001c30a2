package com.example.careplan.household.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HomeTenure {
    OWNER,
    RENTER;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
