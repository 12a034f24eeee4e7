package com.datagate.policy;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a policy validation.
 *
 * <p>Instances are immutable and are cached by value, so a cached decision is returned exactly as it was
 * first computed.
 */
@Value
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ValidationResult {

    boolean allowed;
    String reason;
    List<String> suggestions;
    FailedPolicy failedPolicy;
    Map<String, Object> metadata;

    @Builder
    @Jacksonized
    private ValidationResult(
            boolean allowed,
            String reason,
            List<String> suggestions,
            FailedPolicy failedPolicy,
            Map<String, Object> metadata
    ) {
        this.allowed = allowed;
        this.reason = reason;
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
        this.failedPolicy = failedPolicy != null ? failedPolicy : FailedPolicy.NONE;
        this.metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    static ValidationResult pass(String reason, Map<String, Object> metadata) {
        return ValidationResult.builder()
                .allowed(true)
                .reason(reason)
                .metadata(metadata)
                .build();
    }

    static ValidationResult deny(FailedPolicy policy, String reason, List<String> suggestions, Map<String, Object> metadata) {
        return ValidationResult.builder()
                .allowed(false)
                .reason(reason)
                .suggestions(suggestions)
                .failedPolicy(policy)
                .metadata(metadata)
                .build();
    }
}
