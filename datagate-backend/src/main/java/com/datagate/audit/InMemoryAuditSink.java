package com.datagate.audit;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the audit trail in memory. Used when no audit log file is configured and in tests.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEntry> entries = new ArrayList<>();

    @Override
    public synchronized void append(AuditEntry entry) {
        entries.add(entry);
    }

    @Override
    public synchronized List<AuditEntry> readRecent(int limit) {
        int size = entries.size();
        int resolvedLimit = limit > 0 ? Math.min(limit, size) : size;
        List<AuditEntry> out = new ArrayList<>(resolvedLimit);
        for (int i = size - 1; i >= size - resolvedLimit; i--) {
            out.add(entries.get(i));
        }
        return out;
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }
}
