package com.example.careplan.journey.model;

import java.math.BigDecimal;
import java.util.Set;

/**
 * A condition a product needs before it unlocks.
 */
public sealed interface Requirement {

    boolean isSatisfiedBy(JourneySnapshot snapshot);

    record ProductComplete(String product) implements Requirement {
        @Override
        public boolean isSatisfiedBy(JourneySnapshot snapshot) {
            return snapshot.isComplete(product);
        }
    }

    record ProgressAtLeast(String product, BigDecimal fraction) implements Requirement {
        @Override
        public boolean isSatisfiedBy(JourneySnapshot snapshot) {
            return snapshot.progressOf(product).compareTo(fraction) >= 0;
        }
    }

    record AnyFlag(Set<String> flagIds) implements Requirement {

        public AnyFlag {
            flagIds = Set.copyOf(flagIds);
        }

        @Override
        public boolean isSatisfiedBy(JourneySnapshot snapshot) {
            return flagIds.stream().anyMatch(snapshot.flags()::contains);
        }
    }
}
