package com.example.careplan.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.List;

/**
 * Journey products and the requirement strings that unlock them.
 */
@ConfigurationProperties(prefix = "careplan.journey")
public record JourneyProperties(
        List<ProductDefinition> products,
        BigDecimal confidenceThreshold
) {

    public JourneyProperties {
        if (products == null) {
            products = List.of();
        }
        if (confidenceThreshold == null) {
            confidenceThreshold = new BigDecimal("0.7");
        }
    }

    public record ProductDefinition(String id, String label, List<String> requires) {
        public ProductDefinition {
            if (requires == null) requires = List.of();
            if (label == null) label = id;
        }
    }
}
