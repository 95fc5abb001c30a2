package com.example.careplan.config.properties;

import com.example.careplan.intake.model.Domain;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.List;

/**
 * Intake question catalog: every question id the engine accepts, the domain it scores
 * into and the points and flags each option carries.
 */
@ConfigurationProperties(prefix = "careplan.intake")
public record IntakeCatalogProperties(List<QuestionDefinition> questions) {

    public IntakeCatalogProperties {
        if (questions == null) {
            questions = List.of();
        }
    }

    public record QuestionDefinition(
            String id,
            String label,
            Domain domain,
            boolean required,
            boolean multiSelect,
            List<OptionDefinition> options
    ) {
        public QuestionDefinition {
            if (options == null) options = List.of();
            if (label == null) label = id;
        }
    }

    public record OptionDefinition(
            String value,
            String label,
            BigDecimal score,
            List<String> flags
    ) {
        public OptionDefinition {
            if (score == null) score = BigDecimal.ZERO;
            if (flags == null) flags = List.of();
            if (label == null) label = value;
        }
    }
}
