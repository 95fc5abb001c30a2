package com.example.careplan.intake.model;

import com.example.careplan.intake.exception.IntakeValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable intake answers keyed by question id.
 *
 * <p>Values are strings, booleans, numbers or lists of strings. Revisions go through
 * {@link #with(String, Object)}, which returns a new instance.
 */
public final class Answers {

    private static final Answers EMPTY = new Answers(Map.of());

    private final Map<String, Object> values;

    private Answers(Map<String, Object> values) {
        this.values = values;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Answers of(@Nullable Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (key == null || key.isBlank()) {
                throw new IntakeValidationException(List.of("Answer key cannot be blank"));
            }
            Object normalized = normalizeValue(key, value);
            if (normalized != null) {
                copy.put(key, normalized);
            }
        });
        return new Answers(Collections.unmodifiableMap(copy));
    }

    public static Answers empty() {
        return EMPTY;
    }

    private static Object normalizeValue(String key, Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Number) {
            return value;
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(item -> {
                        if (item instanceof String || item instanceof Number || item instanceof Boolean) {
                            return item.toString();
                        }
                        throw new IntakeValidationException(List.of(
                                "Answer '" + key + "' contains an unsupported list element"));
                    })
                    .toList();
        }
        throw new IntakeValidationException(List.of(
                "Answer '" + key + "' has unsupported type " + value.getClass().getSimpleName()));
    }

    /**
     * Returns a new Answers with one value replaced (or removed when {@code value} is null).
     */
    @NonNull
    public Answers with(@NonNull String key, @Nullable Object value) {
        Map<String, Object> next = new LinkedHashMap<>(values);
        if (value == null) {
            next.remove(key);
        } else {
            next.put(key, value);
        }
        return of(next);
    }

    @NonNull
    public Optional<String> text(@NonNull String key) {
        Object value = values.get(key);
        if (value == null || value instanceof List<?>) {
            return Optional.empty();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    @NonNull
    public List<String> list(@NonNull String key) {
        Object value = values.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(Object::toString).toList();
        }
        return List.of();
    }

    /**
     * True when the question has a meaningful answer: a non-blank scalar or a list with
     * at least one non-blank element.
     */
    public boolean isAnswered(@NonNull String key) {
        Object value = values.get(key);
        if (value == null) {
            return false;
        }
        if (value instanceof List<?> list) {
            return list.stream().anyMatch(item -> !item.toString().isBlank());
        }
        return !value.toString().isBlank();
    }

    public boolean isList(@NonNull String key) {
        return values.get(key) instanceof List<?>;
    }

    @Nullable
    public Object get(@NonNull String key) {
        return values.get(key);
    }

    @NonNull
    public Set<String> keys() {
        return values.keySet();
    }

    @JsonValue
    @NonNull
    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Answers other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Answers" + values.keySet();
    }
}
