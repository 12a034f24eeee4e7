package com.datagate.healing;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class HealingResult {
    private boolean success;
    private String query;
    private List<Map<String, Object>> result;
    /** Number of executions made, starting at 1. */
    private int attempt;
    private boolean healingApplied;
    @Builder.Default
    private List<HealingAttempt> healingHistory = new ArrayList<>();
    private String error;
    private String message;
    /** Column taken from a learned mapping before the first execution. */
    private String learnedMappingApplied;
}
