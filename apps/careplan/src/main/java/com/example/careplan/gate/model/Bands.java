package com.example.careplan.gate.model;

/**
 * Cognition and support bands for one person. A pure function of their answers.
 */
public record Bands(CognitionBand cognition, SupportBand support) {

    public Bands {
        if (cognition == null || support == null) {
            throw new IllegalArgumentException("Both bands are required");
        }
    }
}
