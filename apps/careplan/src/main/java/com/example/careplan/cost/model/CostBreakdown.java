package com.example.careplan.cost.model;

import com.example.careplan.regional.model.RegionalMultiplier;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * The computed, cacheable part of a cost plan. All amounts are in cents precision.
 *
 * @param careMonthly  monthly cost of care without home carry
 * @param totalMonthly care plus home carry when applied
 */
public record CostBreakdown(
        ScenarioType scenario,
        CareSetting careSetting,
        RegionalMultiplier regional,
        List<CostAdjustment> adjustments,
        Map<CostSegment, BigDecimal> segments,
        boolean homeCarryApplied,
        BigDecimal homeCarry,
        BigDecimal careMonthly,
        BigDecimal totalMonthly
) {
    public CostBreakdown {
        adjustments = List.copyOf(adjustments);
        segments = Map.copyOf(segments);
    }
}
