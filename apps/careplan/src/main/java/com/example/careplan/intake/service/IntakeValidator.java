package com.example.careplan.intake.service;

import com.example.careplan.config.properties.IntakeCatalogProperties.QuestionDefinition;
import com.example.careplan.intake.exception.IntakeValidationException;
import com.example.careplan.intake.model.Answers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks answers against the intake catalog and fails fast on any mismatch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntakeValidator {

    private final IntakeCatalog catalog;

    public void validate(@NonNull Answers answers) {
        List<String> violations = new ArrayList<>();

        for (String key : answers.keys()) {
            QuestionDefinition question = catalog.question(key).orElse(null);
            if (question == null) {
                violations.add("Unknown question '" + key + "'");
                continue;
            }
            checkValue(question, answers, violations);
        }

        for (QuestionDefinition required : catalog.requiredQuestions()) {
            if (!answers.isAnswered(required.id())) {
                violations.add("Missing required answer '" + required.id() + "'");
            }
        }

        if (!violations.isEmpty()) {
            log.warn("Rejecting intake answers: {} violation(s), first={}", violations.size(), violations.get(0));
            throw new IntakeValidationException(violations);
        }
    }

    private void checkValue(QuestionDefinition question, Answers answers, List<String> violations) {
        String id = question.id();
        boolean isList = answers.isList(id);

        if (question.multiSelect() != isList) {
            violations.add("Answer '" + id + "' must be " + (question.multiSelect() ? "a list" : "a single value"));
            return;
        }

        // Free-form questions declare no options
        if (question.options().isEmpty()) {
            return;
        }

        List<String> values = isList ? answers.list(id) : answers.text(id).map(List::of).orElse(List.of());
        for (String value : values) {
            if (catalog.option(id, value).isEmpty()) {
                violations.add("Answer '" + id + "' has unknown option '" + value + "'");
            }
        }
    }
}
