package com.example.careplan.config.properties;

import com.example.careplan.flag.model.FlagTone;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Flag schema: display metadata for every flag id a care plan can raise.
 */
@ConfigurationProperties(prefix = "careplan.flags")
public record FlagSchemaProperties(List<FlagDefinition> definitions) {

    public FlagSchemaProperties {
        if (definitions == null) {
            definitions = List.of();
        }
    }

    public record FlagDefinition(
            String id,
            String label,
            String description,
            FlagTone tone,
            int priority,
            String suggestedNextAction
    ) {
        public FlagDefinition {
            if (tone == null) tone = FlagTone.INFO;
            if (priority == 0) priority = 100;
        }
    }
}
