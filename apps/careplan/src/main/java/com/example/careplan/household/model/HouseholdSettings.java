package com.example.careplan.household.model;

import java.math.BigDecimal;

/**
 * Shared household facts used to price the home once for both people.
 */
public record HouseholdSettings(
        boolean keepHome,
        HomeTenure tenure,
        BigDecimal homeCarryOverride,
        String zip,
        String state
) {
    public HouseholdSettings {
        if (tenure == null) {
            tenure = HomeTenure.OWNER;
        }
        if (homeCarryOverride != null && homeCarryOverride.signum() < 0) {
            throw new IllegalArgumentException("Home carry override cannot be negative");
        }
    }
}
