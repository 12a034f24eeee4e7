package com.datagate.ontology;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Concepts mapped to the column names that express them, e.g. {@code tax_identifier -> [tax_id, vat_number]}.
 * Synonym order is significant: earlier names are preferred as healing alternatives.
 */
@Slf4j
public class ColumnOntology {

    private final Map<String, List<String>> concepts;

    public ColumnOntology(Map<String, List<String>> concepts) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (concepts != null) {
            concepts.forEach((concept, columns) -> copy.put(concept, columns != null ? List.copyOf(columns) : List.of()));
        }
        this.concepts = Collections.unmodifiableMap(copy);
    }

    /**
     * Load the ontology from a classpath JSON resource.
     *
     * @param resource classpath resource name
     * @param objectMapper Jackson object mapper
     * @return ontology
     * @throws IllegalStateException when the resource is missing or not valid JSON
     */
    public static ColumnOntology fromClasspath(String resource, ObjectMapper objectMapper) {
        String path = resource.startsWith("/") ? resource.substring(1) : resource;
        ClassLoader cl = Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : ColumnOntology.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("Column ontology resource not found: " + resource);
            }
            Map<String, List<String>> concepts = objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, List<String>>>() {
            });
            log.info("Loaded column ontology (resource={}, concepts={})", resource, concepts.size());
            return new ColumnOntology(concepts);
        } catch (IOException e) {
            throw new IllegalStateException("Invalid column ontology resource " + resource + ": " + e.getMessage(), e);
        }
    }

    public Map<String, List<String>> getConcepts() {
        return concepts;
    }

    /**
     * Concepts whose synonym list contains the column, compared after {@link #normalize}.
     *
     * @param column column name
     * @return concept names, in ontology order
     */
    public List<String> conceptsContaining(String column) {
        String normalized = normalize(column);
        List<String> out = new ArrayList<>();
        for (Map.Entry<String, List<String>> e : concepts.entrySet()) {
            for (String candidate : e.getValue()) {
                if (normalize(candidate).equals(normalized)) {
                    out.add(e.getKey());
                    break;
                }
            }
        }
        return out;
    }

    public List<String> columnsOf(String concept) {
        return concepts.getOrDefault(concept, List.of());
    }

    /**
     * Lowercase and replace hyphens and spaces with underscores.
     *
     * @param column column name
     * @return normalized name
     */
    public static String normalize(String column) {
        if (column == null) {
            return "";
        }
        return column.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    }
}
