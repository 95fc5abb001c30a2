package com.example.careplan.household.model;

import java.math.BigDecimal;

/**
 * Combined monthly cost of a household. Each person's total excludes home carry, which is
 * counted once here.
 */
public record HouseholdTotal(
        BigDecimal primaryTotal,
        BigDecimal partnerTotal,
        BigDecimal homeCarry,
        BigDecimal householdTotal,
        HouseholdSplit split,
        boolean hasPartnerPlan
) {
}
