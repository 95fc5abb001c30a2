package com.example.careplan.cost.service;

import com.example.careplan.common.util.Money;
import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.cost.model.CareSetting;
import com.example.careplan.cost.model.CostBreakdown;
import com.example.careplan.cost.model.CostScenario;
import com.example.careplan.cost.model.CostSegment;
import com.example.careplan.cost.model.ModifierResult;
import com.example.careplan.household.model.HomeTenure;
import com.example.careplan.regional.model.RegionalMultiplier;
import com.example.careplan.regional.service.RegionalMultiplierResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;

/**
 * Computes the itemized monthly cost for one person under a facility or in-home scenario.
 */
@Slf4j
@Service
public class CostCalculator {

    private final RegionalMultiplierResolver regionalResolver;
    private final CostModifierEngine modifierEngine;
    private final HomeCarryResolver homeCarryResolver;
    private final CarePlanProperties.Cost cost;

    public CostCalculator(RegionalMultiplierResolver regionalResolver,
                          CostModifierEngine modifierEngine,
                          HomeCarryResolver homeCarryResolver,
                          CarePlanProperties properties) {
        this.regionalResolver = regionalResolver;
        this.modifierEngine = modifierEngine;
        this.homeCarryResolver = homeCarryResolver;
        this.cost = properties.getCost();
    }

    /**
     * @param careSetting facility setting for facility scenarios; ignored for in-home ones
     */
    @NonNull
    public CostBreakdown calculate(@NonNull CostScenario scenario,
                                   @NonNull CareSetting careSetting,
                                   @Nullable String zip,
                                   @Nullable String state,
                                   @NonNull HomeTenure tenure,
                                   @NonNull Collection<String> costFlags) {
        RegionalMultiplier regional = regionalResolver.resolve(zip, state);

        CareSetting setting;
        BigDecimal base;
        if (scenario instanceof CostScenario.Facility facility) {
            setting = facility.careSetting() != null ? facility.careSetting() : careSetting;
            base = cost.facilityBase(setting);
        } else if (scenario instanceof CostScenario.InHome inHome) {
            setting = CareSetting.IN_HOME;
            base = cost.getInHomeHourlyRate()
                    .multiply(inHome.hoursPerDay(), MathContext.DECIMAL64)
                    .multiply(cost.getDaysPerMonth(), MathContext.DECIMAL64);
        } else {
            throw new IllegalArgumentException("Unsupported cost scenario: " + scenario);
        }

        BigDecimal regionalAmount = base.multiply(regional.multiplier(), MathContext.DECIMAL64);
        ModifierResult modifiers = modifierEngine.apply(regionalAmount, costFlags, setting);

        boolean homeCarryApplied = scenario.keepsHome();
        BigDecimal homeCarry = homeCarryApplied
                ? homeCarryResolver.resolve(scenario.homeCarryOverride(), tenure, regional)
                : Money.ZERO;

        BigDecimal careMonthly = Money.cents(modifiers.finalAmount());
        BigDecimal baseCents = Money.cents(base);
        BigDecimal regionalCents = Money.cents(regionalAmount);

        Map<CostSegment, BigDecimal> segments = new EnumMap<>(CostSegment.class);
        segments.put(CostSegment.BASE, baseCents);
        segments.put(CostSegment.REGIONAL_ADJUSTMENT, regionalCents.subtract(baseCents));
        segments.put(CostSegment.CARE_ADJUSTMENTS, careMonthly.subtract(regionalCents));
        segments.put(CostSegment.HOME_CARRY, homeCarry);

        BigDecimal total = careMonthly.add(homeCarry);
        log.debug("Cost calculated: scenario={}, setting={}, base={}, multiplier={}, adjustments={}, homeCarry={}, total={}",
                scenario.type().code(), setting.code(), baseCents, regional.multiplier(),
                modifiers.adjustments().size(), homeCarry, total);

        return new CostBreakdown(
                scenario.type(),
                setting,
                regional,
                modifiers.adjustments(),
                segments,
                homeCarryApplied,
                homeCarry,
                careMonthly,
                total);
    }
}
