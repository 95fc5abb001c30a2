package com.example.careplan.common.exception;

import com.example.careplan.careplan.exception.DegradedCarePlanException;
import com.example.careplan.common.util.StringSanitizer;
import com.example.careplan.intake.exception.IntakeValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps engine and request errors to JSON error bodies of the form
 * {@code {error, message, details?, timestamp}}. Messages echoed back to callers are
 * stripped of control characters and truncated.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 100;
    private static final int MAX_FIELD_NAME_LENGTH = 50;
    private static final int MAX_DETAILS = 20;

    /**
     * Intake answers that do not fit the question catalog. Lists each violation.
     */
    @ExceptionHandler(IntakeValidationException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIntakeValidation(@NonNull IntakeValidationException ex) {
        LOG.warn("Intake validation failed: {} violations", ex.getViolations().size());

        List<String> details = ex.getViolations().stream()
                .limit(MAX_DETAILS)
                .map(GlobalExceptionHandler::forResponse)
                .toList();
        return error(HttpStatus.BAD_REQUEST, "invalid_intake", "Intake answers are invalid", details);
    }

    /**
     * Cost requests for care plans that only carry the placeholder tier.
     */
    @ExceptionHandler(DegradedCarePlanException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleDegradedCarePlan(@NonNull DegradedCarePlanException ex) {
        LOG.warn("Degraded care plan: {}", StringSanitizer.forLog(ex.getCarePlanId()));
        return error(HttpStatus.CONFLICT, "care_plan_degraded",
                "The care plan has no determined tier. Complete the care plan first.", null);
    }

    /**
     * Bean validation failures on {@code @Valid} request bodies, with one entry per field.
     */
    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleValidationErrors(@NonNull WebExchangeBindException ex) {
        LOG.warn("Validation error: {} field errors", ex.getBindingResult().getFieldErrorCount());

        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .limit(MAX_DETAILS)
                .map(error -> Map.of(
                        "field", fieldName(error.getField()),
                        "message", forResponse(error.getDefaultMessage())))
                .toList();
        return error(HttpStatus.BAD_REQUEST, "validation_error", "Request validation failed", fieldErrors);
    }

    /**
     * Unreadable bodies, including scenarios rejected while they are being constructed.
     */
    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleInputException(@NonNull ServerWebInputException ex) {
        LOG.warn("Input error: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return error(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format", null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(@NonNull IllegalArgumentException ex) {
        LOG.warn("Illegal argument: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return error(HttpStatus.BAD_REQUEST, "invalid_argument", forResponse(ex.getMessage()), null);
    }

    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<Map<String, Object>> handleGeneral(@NonNull Exception ex) {
        LOG.error("Unhandled exception: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", null);
    }

    @NonNull
    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message,
                                                             @Nullable List<?> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }

    @NonNull
    private static String fieldName(@Nullable String field) {
        if (field == null || field.isBlank()) {
            return "unknown";
        }
        // alphanumerics, dots and underscores only
        return StringSanitizer.forLog(field.replaceAll("[^a-zA-Z0-9._]", ""), MAX_FIELD_NAME_LENGTH);
    }

    @NonNull
    private static String forResponse(@Nullable String message) {
        if (message == null || message.isBlank()) {
            return "Invalid value";
        }
        String sanitized = message.replaceAll("[\\r\\n\\t]", " ");
        if (sanitized.length() > MAX_RESPONSE_MESSAGE_LENGTH) {
            return sanitized.substring(0, MAX_RESPONSE_MESSAGE_LENGTH) + "...";
        }
        return sanitized;
    }
}
