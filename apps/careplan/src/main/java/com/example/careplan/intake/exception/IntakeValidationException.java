package com.example.careplan.intake.exception;

import java.util.List;

/**
 * Thrown when answers do not match the intake catalog: unknown keys, missing required
 * questions or values outside a question's options. Indicates an intake form and engine
 * version mismatch, so it is never recovered from.
 */
public class IntakeValidationException extends RuntimeException {

    private final List<String> violations;

    public IntakeValidationException(List<String> violations) {
        super("Invalid intake answers: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
