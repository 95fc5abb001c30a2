package com.example.careplan.flag.model;

/**
 * A safety or planning flag raised by a care plan, as described by the flag schema.
 */
public record Flag(
        String id,
        String label,
        FlagTone tone,
        String description,
        int priority,
        String suggestedNextAction
) {
}
