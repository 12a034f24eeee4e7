package com.datagate.healing;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One column substitution made while healing a query.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealingAttempt {
    private String failedColumn;
    private List<String> alternatives;
    private String suggestedColumn;
    /** Raw oracle reply; null when the oracle was unavailable. */
    private String oracleRawResponse;
}
