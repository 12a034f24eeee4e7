package com.datagate.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The policy check that denied a call, or {@link #NONE} when the call was allowed.
 */
public enum FailedPolicy {
    NONE,
    RATE_LIMIT,
    RLS,
    COMPLEXITY,
    PII_ACCESS;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static FailedPolicy fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NONE;
        }
        return valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
