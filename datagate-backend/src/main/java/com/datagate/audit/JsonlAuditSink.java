package com.datagate.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Writes the audit trail as JSON Lines, one entry per line.
 */
@Slf4j
public class JsonlAuditSink implements AuditSink {

    private final Path logFile;
    private final ObjectMapper objectMapper;

    public JsonlAuditSink(Path logFile, ObjectMapper objectMapper) {
        this.logFile = logFile;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void append(AuditEntry entry) {
        try {
            String line = objectMapper.writeValueAsString(entry) + System.lineSeparator();
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(logFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write audit entry to " + logFile, e);
        }
    }

    @Override
    public synchronized List<AuditEntry> readRecent(int limit) {
        if (!Files.exists(logFile)) {
            return List.of();
        }

        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read audit log " + logFile, e);
        }

        List<AuditEntry> entries = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, AuditEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping malformed audit line in {}: {}", logFile, e.getOriginalMessage());
            }
        }

        // Newest first; entries sharing a timestamp keep reverse file order.
        Collections.reverse(entries);
        entries.sort(Comparator.comparing(
                (AuditEntry e) -> e.getTimestamp() != null ? e.getTimestamp() : Instant.EPOCH).reversed());

        if (limit > 0 && entries.size() > limit) {
            return new ArrayList<>(entries.subList(0, limit));
        }
        return entries;
    }

    @Override
    public synchronized void clear() {
        try {
            if (Files.exists(logFile)) {
                Files.writeString(logFile, "", StandardCharsets.UTF_8, StandardOpenOption.TRUNCATE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear audit log " + logFile, e);
        }
        log.info("Cleared audit log (file={})", logFile);
    }

    public Path getLogFile() {
        return logFile;
    }
}
