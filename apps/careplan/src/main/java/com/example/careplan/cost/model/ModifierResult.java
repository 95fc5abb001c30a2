package com.example.careplan.cost.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Adjustments in the order they were applied, and the amount after the last one. The final
 * amount is kept at full precision.
 */
public record ModifierResult(List<CostAdjustment> adjustments, BigDecimal finalAmount) {

    public ModifierResult {
        adjustments = List.copyOf(adjustments);
    }
}
