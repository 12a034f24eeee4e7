package com.datagate.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditStatus {
    ATTEMPT,
    SUCCESS,
    ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return AuditStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
