package com.example.careplan.cost.service;

import com.example.careplan.careplan.exception.DegradedCarePlanException;
import com.example.careplan.careplan.model.CarePlan;
import com.example.careplan.common.util.Money;
import com.example.careplan.common.util.StringSanitizer;
import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.cost.cache.CostPlanCache;
import com.example.careplan.cost.model.CareSetting;
import com.example.careplan.cost.model.CostBreakdown;
import com.example.careplan.cost.model.CostPlan;
import com.example.careplan.cost.model.CostRequest;
import com.example.careplan.cost.model.CostScenario;
import com.example.careplan.observability.metrics.BusinessMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Turns a care plan and a scenario into a cost plan, reusing cached breakdowns for identical
 * queries.
 */
@Slf4j
@Service
public class CostPlanService {

    private static final BigDecimal MONTHS_PER_YEAR = BigDecimal.valueOf(12);
    private static final BigDecimal MONTHS_PER_THREE_YEARS = BigDecimal.valueOf(36);

    private final CostCalculator calculator;
    private final CostModifierEngine modifierEngine;
    private final CostPlanCache cache;
    private final BusinessMetrics metrics;
    private final boolean blockDegraded;

    public CostPlanService(CostCalculator calculator,
                           CostModifierEngine modifierEngine,
                           CostPlanCache cache,
                           BusinessMetrics metrics,
                           CarePlanProperties properties) {
        this.calculator = calculator;
        this.modifierEngine = modifierEngine;
        this.cache = cache;
        this.metrics = metrics;
        this.blockDegraded = properties.getCost().isBlockDegradedCarePlans();
    }

    @NonNull
    public Mono<CostPlan> computeCostPlan(@NonNull CarePlan carePlan, @NonNull CostRequest request) {
        if (carePlan.isDegraded() && blockDegraded) {
            log.warn("Cost plan refused: care plan {} has no determined tier",
                    StringSanitizer.forLog(carePlan.carePlanId()));
            metrics.recordCostPlanBlocked();
            return Mono.error(new DegradedCarePlanException(carePlan.carePlanId()));
        }

        CostScenario scenario = request.scenario();
        CareSetting careSetting = careSettingFor(scenario, carePlan);
        Set<String> costFlags = modifierEngine.costFlagsFor(carePlan.flagIds());
        CostQuery query = CostQuery.of(scenario, careSetting, request.zip(), request.state(),
                request.tenure(), costFlags);

        Mono<CostBreakdown> compute = Mono.fromCallable(() -> calculator.calculate(
                scenario, careSetting, request.zip(), request.state(), request.tenure(), costFlags));

        return cache.getOrCompute(query.toKey(), compute)
                .map(breakdown -> toCostPlan(carePlan, breakdown))
                .doOnNext(plan -> {
                    metrics.recordCostPlan(plan.scenario().code());
                    log.info("Cost plan computed for care plan {}: scenario={}, setting={}, total={}",
                            StringSanitizer.forLog(carePlan.carePlanId()),
                            plan.scenario().code(),
                            plan.careSetting().code(),
                            plan.totalMonthly());
                });
    }

    private CareSetting careSettingFor(CostScenario scenario, CarePlan carePlan) {
        if (scenario instanceof CostScenario.Facility facility && facility.careSetting() != null) {
            return facility.careSetting();
        }
        if (scenario instanceof CostScenario.InHome) {
            return CareSetting.IN_HOME;
        }
        return CareSetting.facilityFor(carePlan.finalTier());
    }

    private CostPlan toCostPlan(CarePlan carePlan, CostBreakdown breakdown) {
        return CostPlan.builder()
                .personId(carePlan.personId())
                .carePlanId(carePlan.carePlanId())
                .scenario(breakdown.scenario())
                .careSetting(breakdown.careSetting())
                .regional(breakdown.regional())
                .adjustments(breakdown.adjustments())
                .breakdown(breakdown.segments())
                .homeCarryApplied(breakdown.homeCarryApplied())
                .homeCarry(breakdown.homeCarry())
                .careMonthly(breakdown.careMonthly())
                .totalMonthly(breakdown.totalMonthly())
                .annual(Money.cents(breakdown.totalMonthly().multiply(MONTHS_PER_YEAR)))
                .threeYear(Money.cents(breakdown.totalMonthly().multiply(MONTHS_PER_THREE_YEARS)))
                .build();
    }
}
