package com.example.careplan.journey.model;

import java.util.List;

/**
 * A journey product with its parsed unlock requirements. No requirements means always unlocked.
 */
public record Product(String id, String label, List<Requirement> requirements) {

    public Product {
        requirements = List.copyOf(requirements);
    }

    public boolean isUnlocked(JourneySnapshot snapshot) {
        return requirements.stream().allMatch(r -> r.isSatisfiedBy(snapshot));
    }
}
