package com.example.careplan.household.service;

import com.example.careplan.common.util.Money;
import com.example.careplan.cost.model.CostPlan;
import com.example.careplan.cost.model.ScenarioType;
import com.example.careplan.cost.service.HomeCarryResolver;
import com.example.careplan.household.model.HouseholdSettings;
import com.example.careplan.household.model.HouseholdSplit;
import com.example.careplan.household.model.HouseholdTotal;
import com.example.careplan.regional.service.RegionalMultiplierResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Combines a primary and an optional partner cost plan into one household total, split
 * evenly between the two people. A plan without a monthly care cost is rejected rather than
 * counted as zero.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HouseholdAggregator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final HomeCarryResolver homeCarryResolver;
    private final RegionalMultiplierResolver regionalResolver;

    @NonNull
    public HouseholdTotal aggregate(@NonNull CostPlan primary, @Nullable CostPlan partner,
                                    @NonNull HouseholdSettings settings) {
        BigDecimal primaryTotal = careTotal(primary, "primary");
        BigDecimal partnerTotal = partner == null ? Money.ZERO : careTotal(partner, "partner");

        boolean homeKept = settings.keepHome() || isInHome(primary) || isInHome(partner);
        BigDecimal homeCarry = homeKept
                ? homeCarryResolver.resolve(settings.homeCarryOverride(), settings.tenure(),
                        regionalResolver.resolve(settings.zip(), settings.state()))
                : Money.ZERO;

        BigDecimal householdTotal = Money.cents(primaryTotal.add(partnerTotal).add(homeCarry));
        // an odd cent goes to the primary share so the halves add up to the total
        BigDecimal partnerShare = householdTotal.divide(TWO, 2, RoundingMode.DOWN);
        BigDecimal primaryShare = householdTotal.subtract(partnerShare);

        log.debug("Household total: primary={}, partner={}, homeCarry={}, total={}",
                primaryTotal, partnerTotal, homeCarry, householdTotal);
        return new HouseholdTotal(
                primaryTotal,
                partnerTotal,
                homeCarry,
                householdTotal,
                new HouseholdSplit(primaryShare, partnerShare),
                partner != null);
    }

    private static BigDecimal careTotal(@NonNull CostPlan plan, String role) {
        if (plan.careMonthly() == null) {
            throw new IllegalArgumentException("The " + role + " cost plan has no monthly care cost");
        }
        return Money.cents(plan.careMonthly());
    }

    private static boolean isInHome(@Nullable CostPlan plan) {
        return plan != null && plan.scenario() == ScenarioType.IN_HOME;
    }
}
