package com.example.careplan.journey.service;

import com.example.careplan.careplan.model.CarePlan;
import com.example.careplan.config.properties.JourneyProperties;
import com.example.careplan.config.properties.JourneyProperties.ProductDefinition;
import com.example.careplan.journey.model.JourneySnapshot;
import com.example.careplan.journey.model.Product;
import com.example.careplan.journey.model.Requirement;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides which journey products a person can open. Requirements are parsed once when the
 * service starts, so a malformed requirement stops the application from starting.
 */
@Slf4j
@Service
public class ProductUnlockService {

    public static final String GUIDED_CARE_PLAN = "gcp";
    public static final String COST_PLANNER = "cost_planner";

    private final List<Product> products;
    private final BigDecimal confidenceThreshold;

    public ProductUnlockService(JourneyProperties properties, RequirementParser parser) {
        List<Product> parsed = new ArrayList<>();
        for (ProductDefinition definition : properties.products()) {
            List<Requirement> requirements = new ArrayList<>();
            for (String raw : definition.requires()) {
                try {
                    requirements.add(parser.parse(raw));
                } catch (IllegalArgumentException e) {
                    throw new IllegalStateException(
                            "Product '" + definition.id() + "' has an invalid requirement: " + e.getMessage(), e);
                }
            }
            parsed.add(new Product(definition.id(), definition.label(), requirements));
        }
        this.products = List.copyOf(parsed);
        this.confidenceThreshold = properties.confidenceThreshold();
        log.info("Journey products loaded: {}", products.stream().map(Product::id).toList());
    }

    @NonNull
    public List<Product> products() {
        return products;
    }

    @NonNull
    public List<String> unlocked(@NonNull JourneySnapshot snapshot) {
        return products.stream()
                .filter(p -> p.isUnlocked(snapshot))
                .map(Product::id)
                .toList();
    }

    /**
     * Next product to suggest after a care plan: revisit the care plan when it is degraded or
     * not confident enough, otherwise move on to cost planning.
     */
    @NonNull
    public String suggestedNextProduct(@NonNull CarePlan carePlan) {
        if (carePlan.isDegraded()) {
            return GUIDED_CARE_PLAN;
        }
        if (carePlan.confidence() == null || carePlan.confidence().compareTo(confidenceThreshold) < 0) {
            return GUIDED_CARE_PLAN;
        }
        return COST_PLANNER;
    }
}
