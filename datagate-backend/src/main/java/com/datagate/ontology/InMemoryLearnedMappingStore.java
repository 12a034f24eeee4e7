package com.datagate.ontology;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryLearnedMappingStore implements LearnedMappingStore {

    private final Map<String, Map<String, String>> mappings = new ConcurrentHashMap<>();

    @Override
    public Optional<String> find(String table, String failedColumn) {
        Map<String, String> byColumn = mappings.get(table);
        return byColumn != null ? Optional.ofNullable(byColumn.get(failedColumn)) : Optional.empty();
    }

    @Override
    public void save(String table, String failedColumn, String correctedColumn) {
        mappings.computeIfAbsent(table, k -> new ConcurrentHashMap<>()).put(failedColumn, correctedColumn);
    }

    @Override
    public Map<String, Map<String, String>> getAll() {
        Map<String, Map<String, String>> out = new LinkedHashMap<>();
        mappings.forEach((table, byColumn) -> out.put(table, Map.copyOf(byColumn)));
        return out;
    }
}
