package com.datagate.ontology;

import java.util.Map;
import java.util.Optional;

/**
 * Column corrections learned from successful healing, keyed by table and failed column.
 *
 * <p>The store is a hint cache: concurrent writers may race and the last write wins.
 */
public interface LearnedMappingStore {

    Optional<String> find(String table, String failedColumn);

    void save(String table, String failedColumn, String correctedColumn);

    /**
     * @return snapshot of all mappings, table to (failed column to corrected column)
     */
    Map<String, Map<String, String>> getAll();
}
