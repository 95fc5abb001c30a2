package com.example.careplan.gate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Care intensity levels. These five are the only tiers a recommendation may carry.
 */
public enum Tier {
    NO_CARE_NEEDED("no_care_needed", "No Care Needed"),
    IN_HOME("in_home", "In-Home Care"),
    ASSISTED_LIVING("assisted_living", "Assisted Living"),
    MEMORY_CARE("memory_care", "Memory Care"),
    MEMORY_CARE_HIGH_ACUITY("memory_care_high_acuity", "Memory Care (High Acuity)");

    /**
     * Placeholder tier used when neither the scorer nor the advisory produced a tier.
     */
    public static final Tier SAFE_DEFAULT = ASSISTED_LIVING;

    private static final Set<Tier> MEMORY_CARE_TIERS = EnumSet.of(MEMORY_CARE, MEMORY_CARE_HIGH_ACUITY);

    private static final Map<String, String> ALIASES = Map.of(
            "in_home_care", "in_home",
            "home_care", "in_home",
            "no_care", "no_care_needed",
            "none", "no_care_needed"
    );

    private final String code;
    private final String displayName;

    Tier(String code, String displayName) {
        this.code = code;
        this.displayName = displayName;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isMemoryCare() {
        return MEMORY_CARE_TIERS.contains(this);
    }

    public static Set<Tier> memoryCareTiers() {
        return EnumSet.copyOf(MEMORY_CARE_TIERS);
    }

    /**
     * Normalize a raw tier string (case, whitespace, known aliases) to a canonical tier.
     *
     * @param raw tier code as received from an advisory or a request
     * @return the tier, or empty when the value is blank or not one of the five tiers
     */
    @NonNull
    public static Optional<Tier> normalize(@Nullable String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        String canonical = ALIASES.getOrDefault(key, key);
        return Arrays.stream(values())
                .filter(t -> t.code.equals(canonical))
                .findFirst();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Tier fromCode(String code) {
        return normalize(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown care tier: " + code));
    }
}
