package com.example.careplan.cost.service;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.cost.model.CareSetting;
import com.example.careplan.cost.model.CostBreakdown;
import com.example.careplan.cost.model.CostScenario;
import com.example.careplan.cost.model.CostSegment;
import com.example.careplan.cost.model.ScenarioType;
import com.example.careplan.household.model.HomeTenure;
import com.example.careplan.regional.model.RegionPrecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Set;

import static com.example.careplan.util.CostTestFixtures.CHRONIC;
import static com.example.careplan.util.CostTestFixtures.MEDICATION;
import static com.example.careplan.util.CostTestFixtures.MOBILITY;
import static com.example.careplan.util.CostTestFixtures.ZIP_115;
import static com.example.careplan.util.CostTestFixtures.regionalResolver;
import static com.example.careplan.util.CostTestFixtures.threeModifierProperties;
import static com.example.careplan.util.CostTestFixtures.twoModifierProperties;
import static com.example.careplan.util.CostTestFixtures.zipResolver;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CostCalculator")
class CostCalculatorTest {

    private static final Set<String> THREE_FLAGS = Set.of(MOBILITY, MEDICATION, CHRONIC);

    private CostCalculator calculator;

    @BeforeEach
    void setUp() {
        CarePlanProperties properties = threeModifierProperties();
        calculator = new CostCalculator(
                regionalResolver(),
                new CostModifierEngine(properties),
                new HomeCarryResolver(properties),
                properties);
    }

    @Nested
    @DisplayName("Facility scenario")
    class Facility {

        @Test
        @DisplayName("should apply modifiers to the assisted living base at the national level")
        void shouldPriceAssistedLiving() {
            CostBreakdown breakdown = calculator.calculate(
                    new CostScenario.Facility(CareSetting.ASSISTED_LIVING, false, null),
                    CareSetting.ASSISTED_LIVING, null, null, HomeTenure.OWNER, THREE_FLAGS);

            assertThat(breakdown.scenario()).isEqualTo(ScenarioType.FACILITY);
            assertThat(breakdown.regional().precision()).isEqualTo(RegionPrecision.NATIONAL);
            assertThat(breakdown.careMonthly()).isEqualByComparingTo("5924.34");
            assertThat(breakdown.totalMonthly()).isEqualByComparingTo("5924.34");
            assertThat(breakdown.homeCarryApplied()).isFalse();
        }

        @Test
        @DisplayName("should itemize segments that add up to the total")
        void shouldItemizeSegments() {
            CostBreakdown breakdown = calculator.calculate(
                    new CostScenario.Facility(null, true, null),
                    CareSetting.ASSISTED_LIVING, null, "CA", HomeTenure.OWNER, THREE_FLAGS);

            BigDecimal sum = breakdown.segments().values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
            assertThat(sum).isEqualByComparingTo(breakdown.totalMonthly());
            assertThat(breakdown.segments().get(CostSegment.BASE)).isEqualByComparingTo("4500.00");
            assertThat(breakdown.segments().get(CostSegment.REGIONAL_ADJUSTMENT)).isEqualByComparingTo("1350.00");
        }

        @Test
        @DisplayName("should add home carry only when the home is kept")
        void shouldAddHomeCarryWhenKept() {
            CostBreakdown kept = calculator.calculate(
                    new CostScenario.Facility(CareSetting.ASSISTED_LIVING, true, null),
                    CareSetting.ASSISTED_LIVING, null, null, HomeTenure.OWNER, THREE_FLAGS);

            assertThat(kept.homeCarry()).isEqualByComparingTo("4500.00");
            assertThat(kept.totalMonthly()).isEqualByComparingTo("10424.34");
            assertThat(kept.careMonthly()).isEqualByComparingTo("5924.34");
        }

        @Test
        @DisplayName("should use the care plan setting when the scenario names none")
        void shouldUseCarePlanSetting() {
            CostBreakdown breakdown = calculator.calculate(
                    new CostScenario.Facility(null, false, null),
                    CareSetting.MEMORY_CARE, null, null, HomeTenure.OWNER, Set.of());

            assertThat(breakdown.careSetting()).isEqualTo(CareSetting.MEMORY_CARE);
            assertThat(breakdown.careMonthly()).isEqualByComparingTo("6500.00");
        }

        @Test
        @DisplayName("should refuse the in-home setting for a facility scenario")
        void shouldRefuseInHomeFacility() {
            assertThatThrownBy(() -> new CostScenario.Facility(CareSetting.IN_HOME, false, null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("In-home scenario")
    class InHome {

        @Test
        @DisplayName("should price hours at the regional rate and always add home carry")
        void shouldPriceInHomeCare() {
            CostBreakdown breakdown = calculator.calculate(
                    new CostScenario.InHome(new BigDecimal("4"), null),
                    CareSetting.ASSISTED_LIVING, null, "CA", HomeTenure.OWNER, Set.of());

            // 30.00 x 4 x 30.4 = 3648.00, x 1.30
            assertThat(breakdown.careSetting()).isEqualTo(CareSetting.IN_HOME);
            assertThat(breakdown.careMonthly()).isEqualByComparingTo("4742.40");
            assertThat(breakdown.homeCarryApplied()).isTrue();
            // 4500 x (1 + 0.5 x 0.30)
            assertThat(breakdown.homeCarry()).isEqualByComparingTo("5175.00");
            assertThat(breakdown.totalMonthly()).isEqualByComparingTo("9917.40");
        }

        @Test
        @DisplayName("should use the in-home modifier table")
        void shouldUseInHomeModifiers() {
            CostBreakdown breakdown = calculator.calculate(
                    new CostScenario.InHome(new BigDecimal("2.5"), new BigDecimal("1200")),
                    CareSetting.ASSISTED_LIVING, null, null, HomeTenure.RENTER, Set.of(MOBILITY));

            // 30.00 x 2.5 x 30.4 = 2280.00, x 1.12
            assertThat(breakdown.careMonthly()).isEqualByComparingTo("2553.60");
            assertThat(breakdown.homeCarry()).isEqualByComparingTo("1200.00");
        }

        @Test
        @DisplayName("should refuse hours outside (0, 24]")
        void shouldRefuseInvalidHours() {
            assertThatThrownBy(() -> new CostScenario.InHome(BigDecimal.ZERO, null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new CostScenario.InHome(new BigDecimal("24.5"), null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Zip-priced assisted living")
    class ZipPricedAssistedLiving {

        private CostCalculator zipCalculator;

        @BeforeEach
        void setUp() {
            CarePlanProperties properties = twoModifierProperties();
            zipCalculator = new CostCalculator(
                    zipResolver(),
                    new CostModifierEngine(properties),
                    new HomeCarryResolver(properties),
                    properties);
        }

        @Test
        @DisplayName("should apply the zip multiplier and then each modifier to the running total")
        void shouldChainZipMultiplierAndModifiers() {
            CostBreakdown breakdown = zipCalculator.calculate(
                    new CostScenario.Facility(CareSetting.ASSISTED_LIVING, false, null),
                    CareSetting.ASSISTED_LIVING, ZIP_115, null, HomeTenure.OWNER, Set.of(MOBILITY, MEDICATION));

            assertThat(breakdown.regional().precision()).isEqualTo(RegionPrecision.ZIP);
            assertThat(breakdown.regional().multiplier()).isEqualByComparingTo("1.15");

            assertThat(breakdown.adjustments()).hasSize(2);
            assertThat(breakdown.adjustments().get(0).flagId()).isEqualTo(MOBILITY);
            assertThat(breakdown.adjustments().get(0).amount()).isEqualByComparingTo("414.00");
            assertThat(breakdown.adjustments().get(0).runningTotal()).isEqualByComparingTo("5589.00");
            assertThat(breakdown.adjustments().get(1).flagId()).isEqualTo(MEDICATION);
            assertThat(breakdown.adjustments().get(1).amount()).isEqualByComparingTo("335.34");
            assertThat(breakdown.adjustments().get(1).runningTotal()).isEqualByComparingTo("5924.34");

            assertThat(breakdown.segments().get(CostSegment.BASE)).isEqualByComparingTo("4500.00");
            assertThat(breakdown.segments().get(CostSegment.REGIONAL_ADJUSTMENT)).isEqualByComparingTo("675.00");
            assertThat(breakdown.segments().get(CostSegment.CARE_ADJUSTMENTS)).isEqualByComparingTo("749.34");
            assertThat(breakdown.careMonthly()).isEqualByComparingTo("5924.34");
            assertThat(breakdown.totalMonthly()).isEqualByComparingTo("5924.34");
        }
    }
}
