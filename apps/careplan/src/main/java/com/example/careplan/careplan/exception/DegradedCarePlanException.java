package com.example.careplan.careplan.exception;

import lombok.Getter;

/**
 * Raised when a cost estimate is requested for a care plan whose tier is only the safe
 * placeholder.
 */
@Getter
public class DegradedCarePlanException extends RuntimeException {

    private final String carePlanId;

    public DegradedCarePlanException(String carePlanId) {
        super("Care plan " + carePlanId + " has no determined tier");
        this.carePlanId = carePlanId;
    }
}
