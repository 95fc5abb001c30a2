package com.example.careplan.flag.service;

import com.example.careplan.common.util.StringSanitizer;
import com.example.careplan.config.properties.FlagSchemaProperties;
import com.example.careplan.config.properties.FlagSchemaProperties.FlagDefinition;
import com.example.careplan.flag.model.Flag;
import com.example.careplan.flag.model.FlagTone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Component
public class FlagSchema {

    private static final int UNKNOWN_PRIORITY = 1000;

    private final Map<String, FlagDefinition> definitions;

    public FlagSchema(FlagSchemaProperties properties) {
        Map<String, FlagDefinition> index = new HashMap<>();
        for (FlagDefinition definition : properties.definitions()) {
            if (index.put(definition.id(), definition) != null) {
                throw new IllegalStateException("Duplicate flag definition: " + definition.id());
            }
        }
        this.definitions = Map.copyOf(index);
        log.info("Flag schema loaded with {} definitions", index.size());
    }

    public boolean isDefined(@NonNull String flagId) {
        return definitions.containsKey(flagId);
    }

    /**
     * Resolve a flag id to its display form. Ids missing from the schema get a generic
     * informational flag.
     */
    @NonNull
    public Flag resolve(@NonNull String flagId) {
        FlagDefinition definition = definitions.get(flagId);
        if (definition == null) {
            log.debug("Flag '{}' has no schema definition, using generic flag", StringSanitizer.forLog(flagId));
            return new Flag(flagId, humanize(flagId), FlagTone.INFO, null, UNKNOWN_PRIORITY, null);
        }
        return new Flag(
                definition.id(),
                definition.label() != null ? definition.label() : humanize(flagId),
                definition.tone(),
                definition.description(),
                definition.priority(),
                definition.suggestedNextAction()
        );
    }

    private static String humanize(String flagId) {
        return Arrays.stream(flagId.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1))
                .collect(Collectors.joining(" "));
    }
}
