package com.example.careplan.advisory.model;

import com.example.careplan.gate.model.Tier;

import java.util.Optional;

/**
 * A tier suggested by an advisory model. The tier is kept as received; it may not be one of
 * the known tiers at all.
 *
 * @param tier       raw tier string as returned by the advisory
 * @param confidence self-reported confidence in [0, 1], recorded only
 * @param rationale  free-text explanation, optional
 */
public record AdvisoryOpinion(String tier, Double confidence, String rationale) {

    public static AdvisoryOpinion of(String tier, double confidence) {
        return new AdvisoryOpinion(tier, confidence, null);
    }

    public Optional<Tier> normalizedTier() {
        return Tier.normalize(tier);
    }

    public Optional<Double> confidenceValue() {
        return Optional.ofNullable(confidence);
    }
}
