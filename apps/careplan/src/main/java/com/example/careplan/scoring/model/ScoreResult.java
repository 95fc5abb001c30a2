package com.example.careplan.scoring.model;

import com.example.careplan.gate.model.Tier;
import com.example.careplan.intake.model.Domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Output of the deterministic scorer. An empty tier means the total fell outside every
 * configured band.
 */
public record ScoreResult(
        Optional<Tier> deterministicTier,
        Map<Domain, BigDecimal> domainScores,
        BigDecimal totalScore,
        List<TierRanking> tierRankings,
        List<String> summaryPoints,
        BigDecimal confidence,
        boolean overrideApplied
) {
    public ScoreResult {
        deterministicTier = deterministicTier == null ? Optional.empty() : deterministicTier;
        domainScores = Map.copyOf(domainScores);
        tierRankings = List.copyOf(tierRankings);
        summaryPoints = List.copyOf(summaryPoints);
    }
}
