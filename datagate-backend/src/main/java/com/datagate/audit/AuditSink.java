package com.datagate.audit;

import java.util.List;

/**
 * Append-only destination for audit entries.
 */
public interface AuditSink {

    /**
     * Append an entry. Implementations must fail loudly when the entry cannot be stored.
     *
     * @param entry entry to append
     */
    void append(AuditEntry entry);

    /**
     * Read the most recent entries.
     *
     * @param limit max entries to return, or a non-positive value for all
     * @return entries, newest first
     */
    List<AuditEntry> readRecent(int limit);

    void clear();
}
