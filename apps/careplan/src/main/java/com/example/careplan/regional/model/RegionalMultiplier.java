package com.example.careplan.regional.model;

import java.math.BigDecimal;

public record RegionalMultiplier(BigDecimal multiplier, String regionName, RegionPrecision precision) {

    public static final String NATIONAL_REGION_NAME = "National Average";

    public static RegionalMultiplier national(BigDecimal multiplier) {
        return new RegionalMultiplier(multiplier, NATIONAL_REGION_NAME, RegionPrecision.NATIONAL);
    }
}
