package com.datagate.healing;

import com.datagate.governance.GovernedTool;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Exposes {@link SelfHealingQueryExecutor} as a governed tool taking {@code {table, column, filter}}.
 */
public class QueryWithHealingTool implements GovernedTool {

    public static final String NAME = "query_with_healing";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final SelfHealingQueryExecutor executor;
    private final Validator validator;
    private final ObjectMapper objectMapper;

    public QueryWithHealingTool(SelfHealingQueryExecutor executor, Validator validator, ObjectMapper objectMapper) {
        this.executor = executor;
        this.validator = validator;
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalArgumentException when table or column is missing or not a plain identifier
     */
    @Override
    public Map<String, Object> execute(Map<String, Object> arguments) {
        HealingQueryRequest request = objectMapper.convertValue(arguments != null ? arguments : Map.of(), HealingQueryRequest.class);
        Set<ConstraintViolation<HealingQueryRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            String details = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .collect(Collectors.joining(", "));
            throw new IllegalArgumentException("Invalid query_with_healing request: " + details);
        }

        HealingResult result = executor.queryWithHealing(request.getTable(), request.getColumn(), request.getFilter());
        return objectMapper.convertValue(result, MAP_TYPE);
    }
}
