package com.datagate.ontology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Learned mappings persisted as a JSON object: {@code {"table": {"failed_column": "corrected_column"}}}.
 *
 * <p>The file is re-read on every lookup so that mappings written by other processes are picked up.
 * A missing or malformed file reads as empty.
 */
@Slf4j
public class JsonFileLearnedMappingStore implements LearnedMappingStore {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>> MAPPINGS_TYPE =
            new TypeReference<>() {
            };

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileLearnedMappingStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<String> find(String table, String failedColumn) {
        Map<String, String> byColumn = load().get(table);
        return byColumn != null ? Optional.ofNullable(byColumn.get(failedColumn)) : Optional.empty();
    }

    @Override
    public synchronized void save(String table, String failedColumn, String correctedColumn) {
        Map<String, Map<String, String>> mappings = load();
        mappings.computeIfAbsent(table, k -> new LinkedHashMap<>()).put(failedColumn, correctedColumn);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), mappings);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write learned mappings to " + file, e);
        }
        log.info("Saved learned mapping (table={}, failed_column={}, corrected_column={})", table, failedColumn, correctedColumn);
    }

    @Override
    public Map<String, Map<String, String>> getAll() {
        return load();
    }

    private Map<String, Map<String, String>> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Map<String, String>> out = new LinkedHashMap<>();
            Map<String, LinkedHashMap<String, String>> raw = objectMapper.readValue(file.toFile(), MAPPINGS_TYPE);
            if (raw != null) {
                raw.forEach((table, byColumn) -> out.put(table, byColumn != null ? byColumn : new LinkedHashMap<>()));
            }
            return out;
        } catch (IOException e) {
            log.warn("Ignoring unreadable learned mappings file {}: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
