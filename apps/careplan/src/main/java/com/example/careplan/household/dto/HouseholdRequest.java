package com.example.careplan.household.dto;

import com.example.careplan.cost.model.CostPlan;
import com.example.careplan.household.model.HouseholdSettings;
import jakarta.validation.constraints.NotNull;

/**
 * Partner plan is optional; a missing partner counts as zero cost.
 */
public record HouseholdRequest(
        @NotNull CostPlan primary,
        CostPlan partner,
        @NotNull HouseholdSettings settings
) {
}
