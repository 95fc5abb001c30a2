package com.example.careplan.advisory.model;

import com.example.careplan.gate.model.AllowedTierSet;
import com.example.careplan.gate.model.Bands;
import com.example.careplan.intake.model.Domain;

import java.math.BigDecimal;
import java.util.Map;

/**
 * What an advisory model is shown. Raw answers are deliberately absent.
 */
public record AdjudicationContext(
        Bands bands,
        AllowedTierSet allowed,
        Map<Domain, BigDecimal> domainScores,
        boolean riskyBehaviors
) {
    public AdjudicationContext {
        domainScores = Map.copyOf(domainScores);
    }
}
