package com.example.careplan.cost.model;

import com.example.careplan.household.model.HomeTenure;

/**
 * Parameters of a cost estimate besides the care plan itself.
 */
public record CostRequest(CostScenario scenario, String zip, String state, HomeTenure tenure) {

    public CostRequest {
        if (scenario == null) {
            throw new IllegalArgumentException("Cost scenario is required");
        }
        if (tenure == null) {
            tenure = HomeTenure.OWNER;
        }
    }
}
