package com.example.careplan.regional.indicator;

import com.example.careplan.regional.model.RegionalCostTable;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Reports whether regional cost data loaded via /actuator/health/regionalData.
 * A degraded table still serves national defaults, so it is reported as UNKNOWN rather
 * than DOWN.
 */
@Component("regionalDataHealthIndicator")
@RequiredArgsConstructor
public class RegionalDataHealthIndicator implements ReactiveHealthIndicator {

    private final RegionalCostTable table;

    @Override
    public Mono<Health> health() {
        Health.Builder builder = table.status().isDegraded() ? Health.unknown() : Health.up();
        return Mono.just(builder
                .withDetail("status", table.status().name())
                .withDetail("zipEntries", table.zip().size())
                .withDetail("zip3Entries", table.zip3().size())
                .withDetail("stateEntries", table.state().size())
                .withDetail("defaultMultiplier", table.defaultMultiplier())
                .withDetail("skippedEntries", table.skippedEntries())
                .build());
    }
}
