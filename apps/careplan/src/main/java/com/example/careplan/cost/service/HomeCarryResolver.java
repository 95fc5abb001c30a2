package com.example.careplan.cost.service;

import com.example.careplan.common.util.Money;
import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.household.model.HomeTenure;
import com.example.careplan.regional.model.RegionalMultiplier;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Monthly cost of keeping the home. An amount entered by the caller is used as is; otherwise
 * the tenure baseline is scaled by half of the regional deviation from the national level.
 */
@Component
public class HomeCarryResolver {

    private final CarePlanProperties.Cost cost;

    public HomeCarryResolver(CarePlanProperties properties) {
        this.cost = properties.getCost();
    }

    @NonNull
    public BigDecimal resolve(@Nullable BigDecimal override, @NonNull HomeTenure tenure,
                              @NonNull RegionalMultiplier regional) {
        if (override != null) {
            return Money.cents(override);
        }
        BigDecimal baseline = tenure == HomeTenure.RENTER ? cost.getRenterHomeCarry() : cost.getOwnerHomeCarry();
        BigDecimal dampened = BigDecimal.ONE.add(
                cost.getHomeCarryDampening().multiply(regional.multiplier().subtract(BigDecimal.ONE)),
                MathContext.DECIMAL64);
        return Money.cents(baseline.multiply(dampened, MathContext.DECIMAL64));
    }
}
