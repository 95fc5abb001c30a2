package com.example.careplan.adjudication.service;

import com.example.careplan.adjudication.model.AdjudicationDecision;
import com.example.careplan.adjudication.model.DecisionSource;
import com.example.careplan.adjudication.model.ReasonCode;
import com.example.careplan.advisory.model.AdvisoryOpinion;
import com.example.careplan.gate.model.AllowedTierSet;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.observability.metrics.BusinessMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TierAdjudicator")
class TierAdjudicatorTest {

    private static final AllowedTierSet NON_MEMORY_CARE = AllowedTierSet.of(
            EnumSet.of(Tier.NO_CARE_NEEDED, Tier.IN_HOME, Tier.ASSISTED_LIVING));

    private SimpleMeterRegistry registry;
    private TierAdjudicator adjudicator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        adjudicator = new TierAdjudicator(new BusinessMetrics(registry));
    }

    @Nested
    @DisplayName("Valid advisory")
    class ValidAdvisory {

        @Test
        @DisplayName("should take an allowed advisory tier over the deterministic tier")
        void shouldPreferAllowedAdvisory() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.of(Tier.ASSISTED_LIVING),
                    Optional.of(AdvisoryOpinion.of("memory_care", 0.75)),
                    AllowedTierSet.all(),
                    true);

            assertThat(decision.finalTier()).isEqualTo(Tier.MEMORY_CARE);
            assertThat(decision.source()).isEqualTo(DecisionSource.ADVISORY);
            assertThat(decision.reason()).isEqualTo(ReasonCode.ADVISORY_VALID);
            assertThat(decision.rejectedTier()).isEqualTo("assisted_living");
            assertThat(decision.advisoryConfidence()).contains(0.75);
            assertThat(decision.riskyBehaviors()).isTrue();
        }

        @Test
        @DisplayName("should take the advisory tier at any confidence")
        void shouldIgnoreConfidence() {
            for (int percent = 1; percent <= 99; percent++) {
                double confidence = percent / 100.0;
                AdjudicationDecision decision = adjudicator.adjudicate(
                        Optional.of(Tier.NO_CARE_NEEDED),
                        Optional.of(AdvisoryOpinion.of("in_home", confidence)),
                        NON_MEMORY_CARE,
                        false);

                assertThat(decision.finalTier())
                        .as("confidence %s", confidence)
                        .isEqualTo(Tier.IN_HOME);
                assertThat(decision.reason()).isEqualTo(ReasonCode.ADVISORY_VALID);
            }
        }

        @Test
        @DisplayName("should report advisory source even when both sources agree")
        void shouldReportAdvisoryWhenEqual() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.of(Tier.IN_HOME),
                    Optional.of(AdvisoryOpinion.of("in_home", 0.9)),
                    NON_MEMORY_CARE,
                    false);

            assertThat(decision.source()).isEqualTo(DecisionSource.ADVISORY);
            assertThat(decision.rejectedTier()).isNull();
        }

        @Test
        @DisplayName("should normalize advisory aliases and case")
        void shouldNormalizeAliases() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.of(Tier.ASSISTED_LIVING),
                    Optional.of(AdvisoryOpinion.of(" In-Home-Care ", 0.6)),
                    NON_MEMORY_CARE,
                    false);

            assertThat(decision.finalTier()).isEqualTo(Tier.IN_HOME);
            assertThat(decision.rawAdvisoryTier()).isEqualTo(" In-Home-Care ");
        }

        @Test
        @DisplayName("should use a valid advisory when the scorer produced no tier")
        void shouldUseAdvisoryWithoutDeterministic() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.empty(),
                    Optional.of(AdvisoryOpinion.of("in_home", 0.4)),
                    NON_MEMORY_CARE,
                    false);

            assertThat(decision.finalTier()).isEqualTo(Tier.IN_HOME);
            assertThat(decision.isDegraded()).isFalse();
        }
    }

    @Nested
    @DisplayName("Rejected advisory")
    class RejectedAdvisory {

        @Test
        @DisplayName("should fall back to the deterministic tier for an unknown advisory tier")
        void shouldRejectUnknownTier() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.of(Tier.MEMORY_CARE),
                    Optional.of(AdvisoryOpinion.of("skilled_nursing", 0.95)),
                    AllowedTierSet.all(),
                    true);

            assertThat(decision.finalTier()).isEqualTo(Tier.MEMORY_CARE);
            assertThat(decision.source()).isEqualTo(DecisionSource.DETERMINISTIC);
            assertThat(decision.reason()).isEqualTo(ReasonCode.ADVISORY_TIER_NOT_ALLOWED);
            assertThat(decision.rejectedTier()).isEqualTo("skilled_nursing");
            assertThat(decision.advisoryTier()).isEmpty();
        }

        @Test
        @DisplayName("should reject a known advisory tier the gates removed")
        void shouldRejectGatedOutTier() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.of(Tier.IN_HOME),
                    Optional.of(AdvisoryOpinion.of("memory_care", 0.99)),
                    NON_MEMORY_CARE,
                    false);

            assertThat(decision.finalTier()).isEqualTo(Tier.IN_HOME);
            assertThat(decision.reason()).isEqualTo(ReasonCode.ADVISORY_TIER_NOT_ALLOWED);
            assertThat(decision.advisoryTier()).contains(Tier.MEMORY_CARE);
            assertThat(decision.rejectedTier()).isEqualTo("memory_care");
        }

        @Test
        @DisplayName("should mark the decision degraded when the advisory is rejected and no deterministic tier exists")
        void shouldDegradeWhenRejectedWithoutDeterministic() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.empty(),
                    Optional.of(AdvisoryOpinion.of("skilled_nursing", 0.9)),
                    AllowedTierSet.all(),
                    false);

            assertThat(decision.finalTier()).isEqualTo(Tier.SAFE_DEFAULT);
            assertThat(decision.reason()).isEqualTo(ReasonCode.DOUBLE_MISSING_DEFAULT);
            assertThat(decision.source()).isEqualTo(DecisionSource.SAFE_DEFAULT);
            assertThat(decision.isDegraded()).isTrue();
            assertThat(decision.rawAdvisoryTier()).isEqualTo("skilled_nursing");
            assertThat(decision.rejectedTier()).isEqualTo("skilled_nursing");
        }

        @Test
        @DisplayName("should mark the decision degraded when a gated-out advisory is the only tier")
        void shouldDegradeWhenGatedOutWithoutDeterministic() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.empty(),
                    Optional.of(AdvisoryOpinion.of("memory_care", 0.95)),
                    NON_MEMORY_CARE,
                    false);

            assertThat(decision.isDegraded()).isTrue();
            assertThat(decision.advisoryTier()).contains(Tier.MEMORY_CARE);
            assertThat(decision.rejectedTier()).isEqualTo("memory_care");
        }
    }

    @Nested
    @DisplayName("Missing inputs")
    class MissingInputs {

        @Test
        @DisplayName("should keep the deterministic tier when there is no advisory")
        void shouldKeepDeterministicWithoutAdvisory() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.of(Tier.ASSISTED_LIVING), Optional.empty(), NON_MEMORY_CARE, false);

            assertThat(decision.finalTier()).isEqualTo(Tier.ASSISTED_LIVING);
            assertThat(decision.source()).isEqualTo(DecisionSource.DETERMINISTIC);
            assertThat(decision.reason()).isEqualTo(ReasonCode.ADVISORY_UNAVAILABLE);
            assertThat(decision.rawAdvisoryTier()).isNull();
        }

        @Test
        @DisplayName("should default to assisted living and mark the decision degraded when both are missing")
        void shouldDefaultWhenBothMissing() {
            AdjudicationDecision decision = adjudicator.adjudicate(
                    Optional.empty(), Optional.empty(), NON_MEMORY_CARE, false);

            assertThat(decision.finalTier()).isEqualTo(Tier.ASSISTED_LIVING);
            assertThat(decision.reason()).isEqualTo(ReasonCode.DOUBLE_MISSING_DEFAULT);
            assertThat(decision.source()).isEqualTo(DecisionSource.SAFE_DEFAULT);
            assertThat(decision.isDegraded()).isTrue();
        }
    }

    @Test
    @DisplayName("should refuse a final tier outside the allowed set")
    void shouldRefuseFinalTierOutsideAllowed() {
        assertThatThrownBy(() -> adjudicator.adjudicate(
                Optional.of(Tier.MEMORY_CARE), Optional.empty(), NON_MEMORY_CARE, false))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("MEMORY_CARE");
    }

    @Test
    @DisplayName("should count decisions by source and reason")
    void shouldRecordMetrics() {
        adjudicator.adjudicate(Optional.of(Tier.IN_HOME), Optional.empty(), NON_MEMORY_CARE, false);

        assertThat(registry.get("adjudication.decision")
                .tag("source", "deterministic")
                .tag("reason", "advisory_unavailable")
                .counter().count()).isEqualTo(1.0);
    }
}
