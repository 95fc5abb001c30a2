package com.example.careplan.intake.service;

import com.example.careplan.config.properties.IntakeCatalogProperties;
import com.example.careplan.config.properties.IntakeCatalogProperties.OptionDefinition;
import com.example.careplan.config.properties.IntakeCatalogProperties.QuestionDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Indexed view of the configured intake questions, in configuration order.
 */
@Slf4j
@Component
public class IntakeCatalog {

    private final Map<String, QuestionDefinition> questions;

    public IntakeCatalog(IntakeCatalogProperties properties) {
        Map<String, QuestionDefinition> index = new LinkedHashMap<>();
        for (QuestionDefinition question : properties.questions()) {
            if (question.id() == null || question.id().isBlank()) {
                throw new IllegalStateException("Intake question without an id");
            }
            if (question.domain() == null) {
                throw new IllegalStateException("Intake question '" + question.id() + "' has no domain");
            }
            if (index.put(question.id(), question) != null) {
                throw new IllegalStateException("Duplicate intake question id: " + question.id());
            }
        }
        this.questions = Collections.unmodifiableMap(index);

        log.info("Intake catalog loaded with {} questions", index.size());
    }

    @NonNull
    public Optional<QuestionDefinition> question(@NonNull String id) {
        return Optional.ofNullable(questions.get(id));
    }

    public boolean isKnown(@NonNull String id) {
        return questions.containsKey(id);
    }

    @NonNull
    public Collection<QuestionDefinition> questions() {
        return questions.values();
    }

    @NonNull
    public List<QuestionDefinition> requiredQuestions() {
        return questions.values().stream()
                .filter(QuestionDefinition::required)
                .toList();
    }

    /**
     * Find the option of a question matching a given answer value.
     */
    @NonNull
    public Optional<OptionDefinition> option(@NonNull String questionId, @NonNull String value) {
        return question(questionId)
                .flatMap(q -> q.options().stream()
                        .filter(o -> o.value().equals(value))
                        .findFirst());
    }
}
