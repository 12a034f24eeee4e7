package com.datagate.healing;

import com.datagate.ontology.ColumnOntology;
import com.datagate.ontology.LearnedMappingStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Finds candidate replacements for a column the database rejected.
 *
 * <p>Candidates come, in order, from the learned mapping for the table, then from every ontology concept
 * that lists the failed column. Only when both yield nothing are concepts matched by name: a concept
 * qualifies when one of its name tokens equals a token (longer than two characters) of the failed column.
 */
public class SemanticColumnMatcher {

    static final int MAX_ALTERNATIVES = 10;

    private final ColumnOntology ontology;
    private final LearnedMappingStore learnedMappings;

    public SemanticColumnMatcher(ColumnOntology ontology, LearnedMappingStore learnedMappings) {
        this.ontology = ontology;
        this.learnedMappings = learnedMappings;
    }

    public List<String> findAlternatives(String failedColumn, String table) {
        List<String> alternatives = new ArrayList<>();

        learnedMappings.find(table, failedColumn)
                .filter(suggested -> !suggested.equals(failedColumn))
                .ifPresent(alternatives::add);

        String normalizedFailed = ColumnOntology.normalize(failedColumn);
        for (String concept : ontology.conceptsContaining(failedColumn)) {
            for (String candidate : ontology.columnsOf(concept)) {
                if (!ColumnOntology.normalize(candidate).equals(normalizedFailed) && !alternatives.contains(candidate)) {
                    alternatives.add(candidate);
                }
            }
        }

        if (alternatives.isEmpty()) {
            List<String> tokens = Arrays.stream(normalizedFailed.split("_"))
                    .filter(token -> token.length() > 2)
                    .toList();
            for (Map.Entry<String, List<String>> e : ontology.getConcepts().entrySet()) {
                List<String> conceptTokens = Arrays.asList(e.getKey().split("_"));
                if (tokens.stream().anyMatch(conceptTokens::contains)) {
                    for (String candidate : e.getValue()) {
                        if (!alternatives.contains(candidate)) {
                            alternatives.add(candidate);
                        }
                    }
                }
            }
        }

        alternatives.removeIf(candidate -> candidate.equalsIgnoreCase(failedColumn));
        return alternatives.size() > MAX_ALTERNATIVES
                ? new ArrayList<>(alternatives.subList(0, MAX_ALTERNATIVES))
                : alternatives;
    }
}
