package com.example.careplan.cost.model;

/**
 * Lines of a cost breakdown. Segment amounts add up to the monthly total.
 */
public enum CostSegment {
    BASE,
    REGIONAL_ADJUSTMENT,
    CARE_ADJUSTMENTS,
    HOME_CARRY
}
