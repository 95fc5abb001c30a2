package com.example.careplan.cost.model;

import java.math.BigDecimal;

/**
 * One step of the cumulative modifier chain.
 *
 * @param flagId       cost flag that triggered the step
 * @param percentage   fraction applied to the running total, e.g. 0.08
 * @param amount       dollar increase at this step
 * @param runningTotal amount after this step
 * @param label        display label
 * @param rationale    why the adjustment applies
 */
public record CostAdjustment(
        String flagId,
        BigDecimal percentage,
        BigDecimal amount,
        BigDecimal runningTotal,
        String label,
        String rationale
) {
}
