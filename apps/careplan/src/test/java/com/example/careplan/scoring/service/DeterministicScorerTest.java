package com.example.careplan.scoring.service;

import com.example.careplan.config.CarePlanProperties;
import com.example.careplan.config.CarePlanProperties.TierThreshold;
import com.example.careplan.gate.model.GateResult;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.gate.service.GateEvaluator;
import com.example.careplan.intake.model.Answers;
import com.example.careplan.intake.model.Domain;
import com.example.careplan.intake.service.IntakeCatalog;
import com.example.careplan.scoring.model.ScoreResult;
import com.example.careplan.scoring.model.TierRanking;
import com.example.careplan.util.CarePlanTestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.example.careplan.util.AnswersTestBuilder.aSevereWanderingProfile;
import static com.example.careplan.util.AnswersTestBuilder.anAnswers;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DeterministicScorer")
class DeterministicScorerTest {

    private IntakeCatalog catalog;
    private CarePlanProperties properties;
    private GateEvaluator gateEvaluator;
    private DeterministicScorer scorer;

    @BeforeEach
    void setUp() {
        catalog = new IntakeCatalog(CarePlanTestProperties.intakeCatalog());
        properties = CarePlanTestProperties.carePlanProperties();
        gateEvaluator = new GateEvaluator(properties);
        scorer = new DeterministicScorer(catalog, properties);
    }

    private ScoreResult score(Answers answers) {
        GateResult gates = gateEvaluator.evaluate(answers);
        return scorer.score(answers, gates);
    }

    @Nested
    @DisplayName("Weighted sum")
    class WeightedSum {

        @Test
        @DisplayName("should add option scores into their domains")
        void shouldSumPerDomain() {
            ScoreResult result = score(aSevereWanderingProfile().build());

            assertThat(result.totalScore()).isEqualByComparingTo("20");
            assertThat(result.domainScores().get(Domain.COGNITION)).isEqualByComparingTo("10");
            assertThat(result.domainScores().get(Domain.SAFETY)).isEqualByComparingTo("4");
            assertThat(result.domainScores().get(Domain.ADL_IADL)).isEqualByComparingTo("6");
            assertThat(result.domainScores().get(Domain.MOBILITY)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("should apply domain weights")
        void shouldApplyDomainWeights() {
            properties.getScoring().getDomainWeights().setCognition(new BigDecimal("2"));
            scorer = new DeterministicScorer(catalog, properties);

            ScoreResult result = score(anAnswers().withMemoryChanges("moderate").build());

            assertThat(result.domainScores().get(Domain.COGNITION)).isEqualByComparingTo("12");
            assertThat(result.deterministicTier()).contains(Tier.IN_HOME);
        }

        @Test
        @DisplayName("should count every selected option of a multi-select question")
        void shouldCountMultiSelectOptions() {
            ScoreResult result = score(anAnswers().withBadls("bathing", "toileting", "eating").build());

            assertThat(result.domainScores().get(Domain.ADL_IADL)).isEqualByComparingTo("8");
        }
    }

    @Nested
    @DisplayName("Tier selection")
    class TierSelection {

        @Test
        @DisplayName("should map a zero total to no care needed")
        void shouldMapZeroToNoCare() {
            ScoreResult result = score(anAnswers().build());

            assertThat(result.deterministicTier()).contains(Tier.NO_CARE_NEEDED);
            assertThat(result.overrideApplied()).isFalse();
        }

        @Test
        @DisplayName("should override to memory care for confirmed severe cognition with risky behavior")
        void shouldOverrideToMemoryCare() {
            ScoreResult result = score(aSevereWanderingProfile().build());

            assertThat(result.deterministicTier()).contains(Tier.MEMORY_CARE);
            assertThat(result.overrideApplied()).isTrue();
        }

        @Test
        @DisplayName("should not override when the severe report is unconfirmed")
        void shouldNotOverrideWhenUnconfirmed() {
            ScoreResult result = score(aSevereWanderingProfile().withDiagnosisConfirmed("dx_unsure").build());

            assertThat(result.overrideApplied()).isFalse();
            assertThat(result.deterministicTier()).contains(Tier.ASSISTED_LIVING);
        }

        @Test
        @DisplayName("should fall back to assisted living when the scored tier is gated out")
        void shouldFallBackWhenNotAdmissible() {
            Answers answers = anAnswers()
                    .with("mobility", "bedbound")
                    .with("falls", "multiple")
                    .withBadls("bathing", "dressing", "toileting", "eating", "transferring")
                    .build();

            ScoreResult result = score(answers);

            assertThat(result.totalScore()).isEqualByComparingTo("25");
            assertThat(result.deterministicTier()).contains(Tier.ASSISTED_LIVING);
        }

        @Test
        @DisplayName("should cover fractional totals between integer bands")
        void shouldCoverFractionalTotals() {
            properties.getScoring().getDomainWeights().setMobility(new BigDecimal("0.5"));
            scorer = new DeterministicScorer(catalog, properties);
            Answers answers = anAnswers()
                    .withMemoryChanges("moderate")
                    .with("mobility", "cane")
                    .with("falls", "once")
                    .build();

            ScoreResult result = score(answers);

            assertThat(result.totalScore()).isEqualByComparingTo("8.5");
            assertThat(result.deterministicTier()).contains(Tier.NO_CARE_NEEDED);
        }

        @Test
        @DisplayName("should return no tier when the total is outside every band")
        void shouldReturnEmptyOutsideBands() {
            properties.getScoring().setThresholds(List.of(new TierThreshold(Tier.NO_CARE_NEEDED, 0, 8)));
            scorer = new DeterministicScorer(catalog, properties);

            ScoreResult result = score(anAnswers().withMemoryChanges("moderate").withHoursPerDay("24h").build());

            assertThat(result.totalScore()).isEqualByComparingTo("12");
            assertThat(result.deterministicTier()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Explanation")
    class Explanation {

        @Test
        @DisplayName("should list top contributions as question and answer labels")
        void shouldListSummaryPoints() {
            ScoreResult result = score(aSevereWanderingProfile().build());

            assertThat(result.summaryPoints()).containsExactly(
                    "Memory changes: Severe memory loss",
                    "Hours of help needed per day: Around the clock",
                    "Behaviors: Wandering");
        }

        @Test
        @DisplayName("should cap summary points at five")
        void shouldCapSummaryPoints() {
            Answers answers = anAnswers()
                    .withMemoryChanges("moderate")
                    .with("mobility", "wheelchair")
                    .with("meds_complexity", "complex")
                    .with("falls", "multiple")
                    .withBadls("toileting", "eating", "transferring")
                    .build();

            assertThat(score(answers).summaryPoints()).hasSize(5);
        }

        @Test
        @DisplayName("should rank the winning band by total and the others by midpoint")
        void shouldRankTiers() {
            List<TierRanking> rankings = score(aSevereWanderingProfile().build()).tierRankings();

            assertThat(rankings).extracting(TierRanking::tier).containsExactly(
                    Tier.MEMORY_CARE_HIGH_ACUITY, Tier.MEMORY_CARE, Tier.ASSISTED_LIVING,
                    Tier.IN_HOME, Tier.NO_CARE_NEEDED);
            assertThat(rankings).extracting(TierRanking::score).containsExactly(
                    new BigDecimal("40.0"), new BigDecimal("32.0"), new BigDecimal("20.0"),
                    new BigDecimal("12.5"), new BigDecimal("4.0"));
        }
    }

    @Nested
    @DisplayName("Confidence")
    class Confidence {

        @Test
        @DisplayName("should blend completeness and distance from the band edge")
        void shouldBlendCompletenessAndClarity() {
            // 4 of 11 questions answered, total 20 sits 3 points inside the band
            assertThat(score(aSevereWanderingProfile().build()).confidence())
                    .isEqualByComparingTo("0.62");
        }

        @Test
        @DisplayName("should not drop below the floor")
        void shouldApplyFloor() {
            assertThat(score(anAnswers().build()).confidence()).isEqualByComparingTo("0.50");
        }
    }
}
