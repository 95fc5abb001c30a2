package com.example.careplan.intake.model;

/**
 * Scoring domains an intake question contributes to.
 */
public enum Domain {
    MOBILITY,
    COGNITION,
    ADL_IADL,
    MEDICAL,
    ISOLATION,
    SAFETY
}
