package com.example.careplan.cost.service;

import com.example.careplan.common.util.CacheKeyUtils;
import com.example.careplan.cost.model.CareSetting;
import com.example.careplan.cost.model.CostScenario;
import com.example.careplan.cost.model.ScenarioType;
import com.example.careplan.household.model.HomeTenure;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Everything a cost breakdown depends on. Two equal queries always yield the same breakdown.
 */
record CostQuery(
        ScenarioType scenario,
        CareSetting careSetting,
        String zip,
        String state,
        BigDecimal hoursPerDay,
        boolean keepHome,
        BigDecimal homeCarryOverride,
        HomeTenure tenure,
        SortedSet<String> costFlags
) {

    static CostQuery of(CostScenario scenario, CareSetting careSetting, String zip, String state,
                        HomeTenure tenure, Set<String> costFlags) {
        BigDecimal hours = scenario instanceof CostScenario.InHome inHome ? inHome.hoursPerDay() : null;
        return new CostQuery(
                scenario.type(),
                careSetting,
                blankToNull(zip),
                blankToNull(state),
                hours == null ? null : hours.stripTrailingZeros(),
                scenario.keepsHome(),
                scenario.homeCarryOverride() == null ? null : scenario.homeCarryOverride().stripTrailingZeros(),
                tenure,
                new TreeSet<>(costFlags));
    }

    String toKey() {
        return CacheKeyUtils.key(
                scenario.code(),
                careSetting.code(),
                zip,
                state,
                hoursPerDay == null ? null : hoursPerDay.toPlainString(),
                String.valueOf(keepHome),
                homeCarryOverride == null ? null : homeCarryOverride.toPlainString(),
                tenure.code(),
                String.join(",", costFlags));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim().toUpperCase(Locale.ROOT);
    }
}
