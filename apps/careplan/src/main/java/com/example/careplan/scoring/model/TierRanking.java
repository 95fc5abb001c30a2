package com.example.careplan.scoring.model;

import com.example.careplan.gate.model.Tier;

import java.math.BigDecimal;

/**
 * A tier with the score it is ranked by: the actual total for the winning tier, the
 * midpoint of its band for every other tier.
 */
public record TierRanking(Tier tier, BigDecimal score) {
}
