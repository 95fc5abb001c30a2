package com.example.careplan.gate.model;

/**
 * Output of gate evaluation: the bands, the tiers they permit and whether a
 * risky behavior was reported.
 */
public record GateResult(
        Bands bands,
        AllowedTierSet allowed,
        boolean riskyBehaviors
) {}
