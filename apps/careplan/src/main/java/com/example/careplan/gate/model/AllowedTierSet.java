package com.example.careplan.gate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Tiers the gates permit for one person. Never empty and always contains
 * {@link Tier#SAFE_DEFAULT}, so a placeholder recommendation is always admissible.
 */
public final class AllowedTierSet {

    private final Set<Tier> tiers;

    private AllowedTierSet(Set<Tier> tiers) {
        this.tiers = Collections.unmodifiableSet(tiers);
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static AllowedTierSet of(Collection<Tier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("Allowed tier set cannot be empty");
        }
        EnumSet<Tier> copy = EnumSet.copyOf(tiers);
        if (!copy.contains(Tier.SAFE_DEFAULT)) {
            throw new IllegalArgumentException("Allowed tier set must contain " + Tier.SAFE_DEFAULT.getCode());
        }
        return new AllowedTierSet(copy);
    }

    public static AllowedTierSet all() {
        return new AllowedTierSet(EnumSet.allOf(Tier.class));
    }

    public boolean contains(Tier tier) {
        return tier != null && tiers.contains(tier);
    }

    public boolean allowsMemoryCare() {
        return tiers.contains(Tier.MEMORY_CARE) || tiers.contains(Tier.MEMORY_CARE_HIGH_ACUITY);
    }

    public Set<Tier> asSet() {
        return tiers;
    }

    /**
     * Tiers in ascending care intensity, the order they are serialized and logged in.
     */
    @JsonValue
    public List<Tier> sorted() {
        return List.copyOf(EnumSet.copyOf(tiers));
    }

    public int size() {
        return tiers.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AllowedTierSet other)) return false;
        return tiers.equals(other.tiers);
    }

    @Override
    public int hashCode() {
        return tiers.hashCode();
    }

    @Override
    public String toString() {
        return sorted().stream().map(Tier::getCode).toList().toString();
    }
}
