package com.datagate.audit;

import com.datagate.policy.ValidationResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the audit trail. Entries are written once and never updated.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AuditEntry {
    Instant timestamp;
    String userId;
    String tenantId;
    String toolName;
    Map<String, Object> arguments;
    Object result;
    ValidationResult validation;
    Long executionTimeMs;
    String error;
    AuditStatus status;
}
