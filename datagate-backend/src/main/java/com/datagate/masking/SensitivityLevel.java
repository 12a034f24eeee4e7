package com.datagate.masking;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Masking strictness. {@code STANDARD} keeps the last four digits of phone, SSN and card numbers,
 * {@code STRICT} reveals none.
 */
public enum SensitivityLevel {
    STANDARD,
    STRICT;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse a sensitivity level, defaulting to {@link #STANDARD} for blank or unknown values.
     *
     * @param raw raw value
     * @return sensitivity level
     */
    @JsonCreator
    public static SensitivityLevel from(String raw) {
        if (raw == null || raw.isBlank()) {
            return STANDARD;
        }
        return "strict".equals(raw.trim().toLowerCase(Locale.ROOT)) ? STRICT : STANDARD;
    }
}
