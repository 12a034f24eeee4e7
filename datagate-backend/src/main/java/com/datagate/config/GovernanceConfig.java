package com.datagate.config;

import com.datagate.audit.AuditSink;
import com.datagate.audit.InMemoryAuditSink;
import com.datagate.audit.JsonlAuditSink;
import com.datagate.governance.GovernanceMiddleware;
import com.datagate.governance.GovernedToolRegistry;
import com.datagate.governance.ToolDefinition;
import com.datagate.governance.ToolOptions;
import com.datagate.healing.QueryWithHealingTool;
import com.datagate.masking.PiiMasker;
import com.datagate.masking.SensitivityLevel;
import com.datagate.policy.PolicyEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Wires the governed-execution pipeline: policy engine, masker, audit sink, middleware and tool registry.
 */
@Slf4j
@Configuration
public class GovernanceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PolicyEngine policyEngine(
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${datagate.policy.max-calls-per-hour:100}") int maxCallsPerHour,
            @Value("${datagate.policy.max-complexity-score:100}") int maxComplexityScore,
            @Value("${datagate.policy.cache-ttl-minutes:5}") long cacheTtlMinutes
    ) {
        log.info("Policy engine configured (max_calls_per_hour={}, max_complexity_score={}, cache_ttl_minutes={})",
                maxCallsPerHour, maxComplexityScore, cacheTtlMinutes);
        return new PolicyEngine(maxCallsPerHour, maxComplexityScore, Duration.ofMinutes(cacheTtlMinutes), clock, objectMapper);
    }

    @Bean
    public PiiMasker piiMasker(@Value("${datagate.masking.redacted-fields:}") String redactedFields) {
        Set<String> markers = Arrays.stream(redactedFields.split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        return new PiiMasker(markers);
    }

    @Bean
    public AuditSink auditSink(ObjectMapper objectMapper, @Value("${datagate.audit.log-file:}") String logFile) {
        if (logFile == null || logFile.isBlank()) {
            log.warn("No audit log file configured (datagate.audit.log-file), audit trail is kept in memory only");
            return new InMemoryAuditSink();
        }
        log.info("Audit trail written to {}", logFile);
        return new JsonlAuditSink(Path.of(logFile.trim()), objectMapper);
    }

    @Bean
    public GovernanceMiddleware governanceMiddleware(
            PolicyEngine policyEngine,
            PiiMasker piiMasker,
            AuditSink auditSink,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        return new GovernanceMiddleware(policyEngine, piiMasker, auditSink, objectMapper, clock);
    }

    @Bean
    public ToolDefinition queryWithHealingToolDefinition(
            QueryWithHealingTool queryWithHealingTool,
            @Value("${datagate.healing.sensitivity-level:standard}") String sensitivityLevel
    ) {
        return ToolDefinition.builder()
                .name(QueryWithHealingTool.NAME)
                .description("Query a table column, repairing the query when the column has been renamed")
                .tool(queryWithHealingTool)
                .options(ToolOptions.builder()
                        .sensitivityLevel(SensitivityLevel.from(sensitivityLevel))
                        .build())
                .build();
    }

    @Bean
    public GovernedToolRegistry governedToolRegistry(GovernanceMiddleware middleware, List<ToolDefinition> definitions) {
        return new GovernedToolRegistry(middleware, definitions);
    }
}
