package com.example.careplan.cost.model;

import com.example.careplan.regional.model.RegionalMultiplier;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Monthly cost estimate for one person under one scenario.
 */
@Builder
public record CostPlan(
        String personId,
        String carePlanId,
        ScenarioType scenario,
        CareSetting careSetting,
        RegionalMultiplier regional,
        List<CostAdjustment> adjustments,
        Map<CostSegment, BigDecimal> breakdown,
        boolean homeCarryApplied,
        BigDecimal homeCarry,
        BigDecimal careMonthly,
        BigDecimal totalMonthly,
        BigDecimal annual,
        BigDecimal threeYear
) {
    public CostPlan {
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
        breakdown = breakdown == null ? Map.of() : Map.copyOf(breakdown);
    }
}
