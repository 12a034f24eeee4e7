package com.datagate.governance;

import com.datagate.policy.FailedPolicy;
import com.datagate.policy.ValidationResult;
import lombok.Getter;

import java.util.List;

/**
 * Raised when a governed tool call is denied by policy. The tool has not been executed.
 */
@Getter
public class SecurityPolicyException extends RuntimeException {

    private final FailedPolicy failedPolicy;
    private final List<String> suggestions;
    private final ValidationResult validationResult;

    public SecurityPolicyException(String message, ValidationResult validationResult) {
        super(message);
        this.validationResult = validationResult;
        this.failedPolicy = validationResult.getFailedPolicy();
        this.suggestions = validationResult.getSuggestions();
    }
}
