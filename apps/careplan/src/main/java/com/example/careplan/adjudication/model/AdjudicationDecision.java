package com.example.careplan.adjudication.model;

import com.example.careplan.gate.model.AllowedTierSet;
import com.example.careplan.gate.model.Tier;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Optional;

/**
 * Outcome of tier adjudication with everything needed to explain it afterwards.
 *
 * @param deterministicTier  tier from the scorer, if any
 * @param advisoryTier       advisory tier after normalization, if it was a known tier
 * @param rawAdvisoryTier    advisory tier exactly as received, null when there was no opinion
 * @param advisoryConfidence advisory confidence as received; never used to decide
 * @param allowed            tiers the gates permitted
 * @param finalTier          the chosen tier, always a member of {@code allowed}
 * @param source             which input the final tier came from
 * @param reason             why that input was chosen
 * @param rejectedTier       code of the candidate that lost, null when nothing was rejected
 * @param riskyBehaviors     whether risky behaviors were reported
 */
public record AdjudicationDecision(
        Optional<Tier> deterministicTier,
        Optional<Tier> advisoryTier,
        String rawAdvisoryTier,
        Optional<Double> advisoryConfidence,
        AllowedTierSet allowed,
        Tier finalTier,
        DecisionSource source,
        ReasonCode reason,
        String rejectedTier,
        boolean riskyBehaviors
) {
    public AdjudicationDecision {
        deterministicTier = deterministicTier == null ? Optional.empty() : deterministicTier;
        advisoryTier = advisoryTier == null ? Optional.empty() : advisoryTier;
        advisoryConfidence = advisoryConfidence == null ? Optional.empty() : advisoryConfidence;
        if (!allowed.contains(finalTier)) {
            throw new IllegalStateException("Final tier " + finalTier + " is not in allowed tiers " + allowed);
        }
    }

    @JsonIgnore
    public boolean isDegraded() {
        return reason == ReasonCode.DOUBLE_MISSING_DEFAULT;
    }
}
