package com.example.careplan.cost.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.math.BigDecimal;

/**
 * How care would be delivered for a cost estimate. Facility scenarios carry no hours; in-home
 * scenarios always keep the home.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CostScenario.Facility.class, name = "facility"),
        @JsonSubTypes.Type(value = CostScenario.InHome.class, name = "in_home")
})
public sealed interface CostScenario {

    ScenarioType type();

    BigDecimal homeCarryOverride();

    boolean keepsHome();

    /**
     * @param careSetting       facility type; null means "the facility matching the care plan tier"
     * @param keepHome          whether the home is kept and its carrying cost added
     * @param homeCarryOverride monthly home carry entered by the caller, null to estimate it
     */
    record Facility(CareSetting careSetting, boolean keepHome, BigDecimal homeCarryOverride) implements CostScenario {

        public Facility {
            if (careSetting == CareSetting.IN_HOME) {
                throw new IllegalArgumentException("A facility scenario cannot use the in-home setting");
            }
            validateOverride(homeCarryOverride);
        }

        @Override
        public ScenarioType type() {
            return ScenarioType.FACILITY;
        }

        @Override
        public boolean keepsHome() {
            return keepHome;
        }
    }

    record InHome(BigDecimal hoursPerDay, BigDecimal homeCarryOverride) implements CostScenario {

        private static final BigDecimal MAX_HOURS = BigDecimal.valueOf(24);

        public InHome {
            if (hoursPerDay == null || hoursPerDay.signum() <= 0 || hoursPerDay.compareTo(MAX_HOURS) > 0) {
                throw new IllegalArgumentException("Hours per day must be greater than 0 and at most 24");
            }
            validateOverride(homeCarryOverride);
        }

        @Override
        public ScenarioType type() {
            return ScenarioType.IN_HOME;
        }

        @Override
        public boolean keepsHome() {
            return true;
        }
    }

    private static void validateOverride(BigDecimal override) {
        if (override != null && override.signum() < 0) {
            throw new IllegalArgumentException("Home carry override cannot be negative");
        }
    }
}
