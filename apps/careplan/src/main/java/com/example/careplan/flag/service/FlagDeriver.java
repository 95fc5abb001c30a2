package com.example.careplan.flag.service;

import com.example.careplan.config.properties.IntakeCatalogProperties.OptionDefinition;
import com.example.careplan.config.properties.IntakeCatalogProperties.QuestionDefinition;
import com.example.careplan.flag.model.Flag;
import com.example.careplan.gate.model.GateResult;
import com.example.careplan.gate.model.SupportBand;
import com.example.careplan.intake.model.Answers;
import com.example.careplan.intake.service.IntakeCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the flags raised by the chosen answer options and by the support band.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlagDeriver {

    static final String HIGH_DEPENDENCE = "high_dependence";
    static final String MODERATE_DEPENDENCE = "moderate_dependence";

    private final IntakeCatalog catalog;
    private final FlagSchema schema;

    @NonNull
    public List<Flag> derive(@NonNull Answers answers, @NonNull GateResult gates) {
        Set<String> ids = new LinkedHashSet<>();

        for (QuestionDefinition question : catalog.questions()) {
            List<String> values = answers.isList(question.id())
                    ? answers.list(question.id())
                    : answers.text(question.id()).map(List::of).orElse(List.of());
            for (String value : values) {
                catalog.option(question.id(), value)
                        .map(OptionDefinition::flags)
                        .ifPresent(ids::addAll);
            }
        }

        if (gates.bands().support() == SupportBand.HIGH) {
            ids.add(HIGH_DEPENDENCE);
        } else if (gates.bands().support() == SupportBand.MEDIUM) {
            ids.add(MODERATE_DEPENDENCE);
        }

        List<Flag> flags = ids.stream()
                .map(schema::resolve)
                .sorted(Comparator.comparingInt(Flag::priority).thenComparing(Flag::id))
                .toList();
        log.debug("Flags derived: {}", ids);
        return flags;
    }
}
