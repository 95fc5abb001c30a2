package com.example.careplan.adjudication.service;

import com.example.careplan.adjudication.model.AdjudicationDecision;
import com.example.careplan.adjudication.model.DecisionSource;
import com.example.careplan.adjudication.model.ReasonCode;
import com.example.careplan.advisory.model.AdvisoryOpinion;
import com.example.careplan.common.util.StringSanitizer;
import com.example.careplan.gate.model.AllowedTierSet;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.observability.metrics.BusinessMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Chooses the final tier from the deterministic tier and an optional advisory opinion.
 *
 * <p>A known advisory tier inside the allowed set always wins, whatever its confidence.
 * Anything else falls back to the deterministic tier. When the scorer produced nothing
 * either, the decision is the degraded {@link Tier#SAFE_DEFAULT} placeholder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TierAdjudicator {

    private final BusinessMetrics metrics;

    @NonNull
    public AdjudicationDecision adjudicate(
            @NonNull Optional<Tier> deterministic,
            @NonNull Optional<AdvisoryOpinion> advisory,
            @NonNull AllowedTierSet allowed,
            boolean riskyBehaviors) {

        String rawAdvisory = advisory.map(AdvisoryOpinion::tier).orElse(null);
        Optional<Tier> advisoryTier = advisory.flatMap(AdvisoryOpinion::normalizedTier);
        Optional<Double> confidence = advisory.flatMap(AdvisoryOpinion::confidenceValue);

        AdjudicationDecision decision;

        if (deterministic.isEmpty() && advisory.isEmpty()) {
            decision = safeDefault(allowed, Optional.empty(), null, Optional.empty(), riskyBehaviors);
            log.warn("Adjudication: no deterministic or advisory tier, defaulting to {}",
                    Tier.SAFE_DEFAULT.getCode());

        } else if (advisory.isEmpty()) {
            decision = new AdjudicationDecision(deterministic, Optional.empty(), null, Optional.empty(),
                    allowed, deterministic.get(), DecisionSource.DETERMINISTIC,
                    ReasonCode.ADVISORY_UNAVAILABLE, null, riskyBehaviors);

        } else if (advisoryTier.isEmpty() || !allowed.contains(advisoryTier.get())) {
            String why = advisoryTier.isEmpty() ? "unknown tier" : "not allowed";
            if (deterministic.isEmpty()) {
                decision = safeDefault(allowed, advisoryTier, rawAdvisory, confidence, riskyBehaviors);
                log.warn("Adjudication: rejected advisory tier '{}' ({}), allowed={}, no deterministic tier, "
                                + "defaulting to {}",
                        StringSanitizer.forLog(rawAdvisory), why, allowed, Tier.SAFE_DEFAULT.getCode());
            } else {
                decision = new AdjudicationDecision(deterministic, advisoryTier, rawAdvisory, confidence,
                        allowed, deterministic.get(), DecisionSource.DETERMINISTIC,
                        ReasonCode.ADVISORY_TIER_NOT_ALLOWED, rawAdvisory, riskyBehaviors);
                log.warn("Adjudication: rejected advisory tier '{}' ({}), allowed={}, using {}",
                        StringSanitizer.forLog(rawAdvisory), why, allowed, deterministic.get().getCode());
            }

        } else {
            Tier chosen = advisoryTier.get();
            String rejected = deterministic.filter(d -> d != chosen).map(Tier::getCode).orElse(null);
            decision = new AdjudicationDecision(deterministic, advisoryTier, rawAdvisory, confidence,
                    allowed, chosen, DecisionSource.ADVISORY,
                    ReasonCode.ADVISORY_VALID, rejected, riskyBehaviors);
            if (rejected != null) {
                log.info("Adjudication: advisory tier {} replaces deterministic tier {}", chosen.getCode(), rejected);
            }
        }

        metrics.recordAdjudication(decision.source().code(), decision.reason().name());
        log.debug("Adjudication: final={}, source={}, reason={}",
                decision.finalTier().getCode(), decision.source().code(), decision.reason());
        return decision;
    }

    /**
     * Placeholder decision when no input yields a usable tier. A rejected advisory tier is kept
     * as the rejected candidate.
     */
    private static AdjudicationDecision safeDefault(AllowedTierSet allowed,
                                                    Optional<Tier> advisoryTier,
                                                    String rawAdvisory,
                                                    Optional<Double> confidence,
                                                    boolean riskyBehaviors) {
        return new AdjudicationDecision(Optional.empty(), advisoryTier, rawAdvisory, confidence,
                allowed, Tier.SAFE_DEFAULT, DecisionSource.SAFE_DEFAULT,
                ReasonCode.DOUBLE_MISSING_DEFAULT, rawAdvisory, riskyBehaviors);
    }
}
