package com.datagate.audit;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class InMemoryAuditSinkTest {

    @Test
    void returnsNewestFirst() {
        InMemoryAuditSink sink = new InMemoryAuditSink();
        sink.append(AuditEntry.builder().timestamp(Instant.EPOCH).toolName("a").status(AuditStatus.ATTEMPT).build());
        sink.append(AuditEntry.builder().timestamp(Instant.EPOCH).toolName("a").status(AuditStatus.SUCCESS).build());
        sink.append(AuditEntry.builder().timestamp(Instant.EPOCH).toolName("b").status(AuditStatus.ATTEMPT).build());

        List<AuditEntry> recent = sink.readRecent(2);

        assertEquals(2, recent.size());
        assertEquals("b", recent.get(0).getToolName());
        assertEquals(AuditStatus.SUCCESS, recent.get(1).getStatus());

        sink.clear();
        assertTrue(sink.readRecent(0).isEmpty());
    }
}
