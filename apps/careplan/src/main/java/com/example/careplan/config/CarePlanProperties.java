package com.example.careplan.config;

import com.example.careplan.cost.model.CareSetting;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.intake.model.Domain;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "careplan")
public class CarePlanProperties {

    private Gates gates = new Gates();
    private Scoring scoring = new Scoring();
    private Advisory advisory = new Advisory();
    private Regional regional = new Regional();
    private Cost cost = new Cost();
    private Cache cache = new Cache();

    @Data
    public static class Gates {
        private List<String> riskyBehaviors = List.of("wandering", "elopement", "aggression", "severe_sundowning");
        private String behaviorsQuestion = "behaviors";
        private boolean moderateHighBehaviorGate = false;  // off unless a deployment opts in
    }

    @Data
    public static class Scoring {
        private DomainWeights domainWeights = new DomainWeights();
        private List<TierThreshold> thresholds = new ArrayList<>(List.of(
                new TierThreshold(Tier.NO_CARE_NEEDED, 0, 8),
                new TierThreshold(Tier.IN_HOME, 9, 16),
                new TierThreshold(Tier.ASSISTED_LIVING, 17, 24),
                new TierThreshold(Tier.MEMORY_CARE, 25, 39),
                new TierThreshold(Tier.MEMORY_CARE_HIGH_ACUITY, 40, null)
        ));
        private int maxSummaryPoints = 5;
        private BigDecimal confidenceFloor = new BigDecimal("0.50");
        private BigDecimal clarityDistance = new BigDecimal("3");
    }

    @Data
    public static class DomainWeights {
        private BigDecimal mobility = BigDecimal.ONE;
        private BigDecimal cognition = BigDecimal.ONE;
        private BigDecimal adlIadl = BigDecimal.ONE;
        private BigDecimal medical = BigDecimal.ONE;
        private BigDecimal isolation = BigDecimal.ONE;
        private BigDecimal safety = BigDecimal.ONE;

        public BigDecimal weightFor(Domain domain) {
            return switch (domain) {
                case MOBILITY -> mobility;
                case COGNITION -> cognition;
                case ADL_IADL -> adlIadl;
                case MEDICAL -> medical;
                case ISOLATION -> isolation;
                case SAFETY -> safety;
            };
        }
    }

    /**
     * Score band for one tier. Covers min up to but excluding max + 1, so fractional totals
     * between adjacent integer bands still land somewhere. A null max leaves the band open-ended.
     */
    @Data
    public static class TierThreshold {
        private Tier tier;
        private int min;
        private Integer max;

        public TierThreshold() {
        }

        public TierThreshold(Tier tier, int min, Integer max) {
            this.tier = tier;
            this.min = min;
            this.max = max;
        }

        public boolean contains(BigDecimal score) {
            if (score.compareTo(BigDecimal.valueOf(min)) < 0) {
                return false;
            }
            return max == null || score.compareTo(BigDecimal.valueOf(max + 1L)) < 0;
        }
    }

    @Data
    public static class Advisory {
        private boolean enabled = false;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Regional {
        private String configLocation = "classpath:config/regional_cost_config.json";
    }

    @Data
    public static class Cost {
        private BigDecimal assistedLivingBase = new BigDecimal("4500");
        private BigDecimal memoryCareBase = new BigDecimal("6500");
        private BigDecimal memoryCareHighAcuityBase = new BigDecimal("9000");
        private BigDecimal inHomeHourlyRate = new BigDecimal("30.00");
        private BigDecimal daysPerMonth = new BigDecimal("30.4");
        private BigDecimal ownerHomeCarry = new BigDecimal("4500");
        private BigDecimal renterHomeCarry = new BigDecimal("1800");
        private BigDecimal homeCarryDampening = new BigDecimal("0.5");
        private boolean blockDegradedCarePlans = true;
        private List<String> modifierOrder = new ArrayList<>(List.of(
                "memory_support", "mobility_limited", "adl_support_high", "medication_management",
                "behavioral_concerns", "falls_risk", "chronic_conditions"));
        private String highAcuityFlag = "high_acuity_tier";
        private List<Modifier> modifiers = new ArrayList<>();
        private List<FlagMapping> flagMappings = new ArrayList<>();

        public BigDecimal facilityBase(CareSetting setting) {
            return switch (setting) {
                case ASSISTED_LIVING -> assistedLivingBase;
                case MEMORY_CARE -> memoryCareBase;
                case MEMORY_CARE_HIGH_ACUITY -> memoryCareHighAcuityBase;
                case IN_HOME -> throw new IllegalArgumentException("In-home care has no facility base rate");
            };
        }
    }

    /**
     * One cost modifier with its percentage per care setting. A null percentage means the
     * modifier does not apply in that setting.
     */
    @Data
    public static class Modifier {
        private String flagId;
        private String label;
        private String rationale;
        private BigDecimal assistedLiving;
        private BigDecimal memoryCare;
        private BigDecimal memoryCareHighAcuity;
        private BigDecimal inHome;

        public BigDecimal percentageFor(CareSetting setting) {
            return switch (setting) {
                case ASSISTED_LIVING -> assistedLiving;
                case MEMORY_CARE -> memoryCare;
                case MEMORY_CARE_HIGH_ACUITY -> memoryCareHighAcuity;
                case IN_HOME -> inHome;
            };
        }
    }

    @Data
    public static class FlagMapping {
        private String flag;
        private String costFlag;
    }

    @Data
    public static class Cache {
        private String store = "in-memory";  // "in-memory" or "redis"
        private Duration costTtl = Duration.ofMinutes(30);
        private int maxEntries = 10_000;
    }
}
