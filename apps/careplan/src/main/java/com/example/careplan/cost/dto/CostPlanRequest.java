package com.example.careplan.cost.dto;

import com.example.careplan.careplan.model.CarePlan;
import com.example.careplan.cost.model.CostRequest;
import com.example.careplan.cost.model.CostScenario;
import com.example.careplan.household.model.HomeTenure;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Zip and state are optional; values that are not a valid zip or state code are ignored
 * during regional lookup rather than rejected.
 */
public record CostPlanRequest(
        @NotNull CarePlan carePlan,
        @NotNull CostScenario scenario,
        @Size(max = 10) String zip,
        @Size(max = 2) String state,
        HomeTenure tenure
) {
    public CostRequest toCostRequest() {
        return new CostRequest(scenario, zip, state, tenure);
    }
}
