package com.datagate.governance;

import com.datagate.masking.SensitivityLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-tool governance settings.
 */
@Value
@Builder
public class ToolOptions {

    /** Informational: PII access is detected by the policy engine regardless of this flag. */
    @Builder.Default
    boolean requiresPii = false;

    @Builder.Default
    SensitivityLevel sensitivityLevel = SensitivityLevel.STANDARD;

    /** Upper bound for the tool call, or null for none. */
    Duration timeout;

    public static ToolOptions defaults() {
        return ToolOptions.builder().build();
    }
}
