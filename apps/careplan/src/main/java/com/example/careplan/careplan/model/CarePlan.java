package com.example.careplan.careplan.model;

import com.example.careplan.adjudication.model.AdjudicationDecision;
import com.example.careplan.flag.model.Flag;
import com.example.careplan.gate.model.AllowedTierSet;
import com.example.careplan.gate.model.Bands;
import com.example.careplan.gate.model.Tier;
import com.example.careplan.intake.model.Domain;
import com.example.careplan.scoring.model.TierRanking;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * A care tier recommendation for one person. Immutable; a revised intake produces a new plan.
 */
@Builder(toBuilder = true)
public record CarePlan(
        String carePlanId,
        String personId,
        Tier finalTier,
        BigDecimal confidence,
        AllowedTierSet allowedTiers,
        Bands bands,
        List<Flag> flags,
        List<String> rationale,
        AdjudicationDecision adjudication,
        Map<Domain, BigDecimal> domainScores,
        BigDecimal totalScore,
        List<TierRanking> tierRankings,
        String suggestedNextProduct,
        Instant createdAt
) {
    public CarePlan {
        flags = flags == null ? List.of() : List.copyOf(flags);
        rationale = rationale == null ? List.of() : List.copyOf(rationale);
        domainScores = domainScores == null ? Map.of() : Map.copyOf(domainScores);
        tierRankings = tierRankings == null ? List.of() : List.copyOf(tierRankings);
    }

    /**
     * True when the final tier is only the safe placeholder.
     */
    @JsonIgnore
    public boolean isDegraded() {
        return adjudication != null && adjudication.isDegraded();
    }

    @JsonIgnore
    public List<String> flagIds() {
        return flags.stream().map(Flag::id).toList();
    }
}
