package com.datagate.governance;

import com.datagate.audit.AuditEntry;
import com.datagate.audit.AuditStatus;
import com.datagate.audit.InMemoryAuditSink;
import com.datagate.masking.PiiMasker;
import com.datagate.masking.SensitivityLevel;
import com.datagate.policy.FailedPolicy;
import com.datagate.policy.PolicyEngine;
import com.datagate.policy.ValidationResult;
import com.datagate.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

public class GovernanceMiddlewareTest {

    private PolicyEngine policyEngine;
    private InMemoryAuditSink auditSink;
    private GovernanceMiddleware middleware;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        policyEngine = new PolicyEngine(100, 100, Duration.ofMinutes(5), clock, new ObjectMapper());
        auditSink = new InMemoryAuditSink();
        middleware = new GovernanceMiddleware(policyEngine, new PiiMasker(), auditSink, new ObjectMapper(), clock);
    }

    @AfterEach
    void tearDown() {
        middleware.close();
    }

    @Test
    void masksResultAndAuditsAttemptThenSuccess() throws Exception {
        policyEngine.grantPiiPermission("alice");
        GovernedTool tool = args -> Map.of("email", "alice@example.com", "phone", "(555) 123-4567");

        Object result = middleware.invoke(invocation("customer_contact", RequestContext.forUser("alice"), Map.of("id", 1)),
                tool, ToolOptions.builder().sensitivityLevel(SensitivityLevel.STRICT).build());

        assertEquals(Map.of("email", "***@***.com", "phone", "(***) ***-****"), result);

        List<AuditEntry> entries = chronological();
        assertEquals(2, entries.size());
        assertEquals(AuditStatus.ATTEMPT, entries.get(0).getStatus());
        assertTrue(entries.get(0).getValidation().isAllowed());
        assertEquals(AuditStatus.SUCCESS, entries.get(1).getStatus());
        assertEquals(result, entries.get(1).getResult());
        assertNotNull(entries.get(1).getExecutionTimeMs());
        assertEquals("alice", entries.get(1).getUserId());
    }

    @Test
    void deniedCallIsAuditedAndNeverExecuted() {
        AtomicBoolean executed = new AtomicBoolean();
        GovernedTool tool = args -> {
            executed.set(true);
            return "done";
        };

        SecurityPolicyException e = assertThrows(SecurityPolicyException.class, () -> middleware.invoke(
                invocation("list_orders", RequestContext.of("bob", "US"), Map.of()), tool, ToolOptions.defaults()));

        assertFalse(executed.get());
        assertEquals(FailedPolicy.RLS, e.getFailedPolicy());
        assertEquals("Security policy violation: RLS check failed: User 'bob' cannot access tenant 'US'", e.getMessage());
        assertEquals(e.getValidationResult().getSuggestions(), e.getSuggestions());

        List<AuditEntry> entries = chronological();
        assertEquals(2, entries.size());
        assertEquals(AuditStatus.ATTEMPT, entries.get(0).getStatus());
        assertFalse(entries.get(0).getValidation().isAllowed());
        assertEquals(AuditStatus.ERROR, entries.get(1).getStatus());
        assertEquals("Security policy violation: RLS check failed: User 'bob' cannot access tenant 'US'",
                entries.get(1).getError());
    }

    @Test
    void toolExceptionIsAuditedAndRethrownUnchanged() {
        // user_id in the arguments trips PII detection
        policyEngine.grantPiiPermission("bob");
        IllegalStateException failure = new IllegalStateException("warehouse offline");
        GovernedTool tool = args -> {
            throw failure;
        };

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> middleware.invoke(
                invocation("list_products", null, Map.of("user_id", "bob")), tool, ToolOptions.defaults()));

        assertSame(failure, thrown);
        AuditEntry outcome = auditSink.readRecent(1).get(0);
        assertEquals(AuditStatus.ERROR, outcome.getStatus());
        assertEquals("warehouse offline", outcome.getError());
        assertEquals("bob", outcome.getUserId());
    }

    @Test
    void nestedDenialIsRethrownWithoutSecondOutcomeEntry() {
        GovernedTool outer = args -> middleware.invoke(
                invocation("list_orders", RequestContext.of("bob", "US"), Map.of()), inner -> "never", ToolOptions.defaults());

        SecurityPolicyException e = assertThrows(SecurityPolicyException.class, () -> middleware.invoke(
                invocation("list_products", RequestContext.forUser("alice"), Map.of()), outer, ToolOptions.defaults()));

        assertEquals(FailedPolicy.RLS, e.getFailedPolicy());
        List<AuditEntry> entries = chronological();
        assertEquals(List.of(AuditStatus.ATTEMPT, AuditStatus.ATTEMPT, AuditStatus.ERROR),
                entries.stream().map(AuditEntry::getStatus).toList());
        assertEquals(List.of("alice", "bob", "bob"), entries.stream().map(AuditEntry::getUserId).toList());
    }

    @Test
    void asyncNestedDenialIsNotAuditedAsToolFailure() {
        ValidationResult denied = ValidationResult.builder()
                .allowed(false)
                .reason("inner denied")
                .failedPolicy(FailedPolicy.RLS)
                .build();
        SecurityPolicyException inner = new SecurityPolicyException("Security policy violation: inner denied", denied);
        AsyncGovernedTool tool = args -> CompletableFuture.failedFuture(inner);

        CompletableFuture<Object> future = middleware.invokeAsync(
                invocation("list_products", RequestContext.forUser("alice"), Map.of()), tool, ToolOptions.defaults());

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertSame(inner, e.getCause());
        List<AuditEntry> entries = chronological();
        assertEquals(1, entries.size());
        assertEquals(AuditStatus.ATTEMPT, entries.get(0).getStatus());
    }

    @Test
    void masksCharSequenceResults() throws Exception {
        GovernedTool tool = args -> new StringBuilder("mail john.doe@example.com");

        Object result = middleware.invoke(invocation("list_notes", RequestContext.forUser("carol"), Map.of()),
                tool, ToolOptions.defaults());

        assertEquals("mail ***@***.com", result);
        assertEquals("mail ***@***.com", auditSink.readRecent(1).get(0).getResult());
    }

    @Test
    void contextFallsBackToArgumentsThenDefaultUser() throws Exception {
        GovernedTool tool = args -> "ok";

        middleware.invoke(invocation("list_products", null, Map.of("limit", 5)), tool, ToolOptions.defaults());

        assertEquals(RequestContext.DEFAULT_USER, auditSink.readRecent(1).get(0).getUserId());
    }

    @Test
    void convertsObjectResultsBeforeMasking() throws Exception {
        policyEngine.grantPiiPermission("alice");
        GovernedTool tool = args -> new Contact("Alice", "alice@example.com");

        Object result = middleware.invoke(invocation("customer_card", RequestContext.forUser("alice"), Map.of()),
                tool, ToolOptions.defaults());

        assertEquals(Map.of("name", "Alice", "email", "***@***.com"), result);
    }

    @Test
    void asyncToolIsGovernedLikeSyncTool() throws Exception {
        policyEngine.grantPiiPermission("alice");
        AsyncGovernedTool tool = args -> CompletableFuture.supplyAsync(() -> List.of("ssn 123-45-6789"));

        Object result = middleware.invokeAsync(invocation("pii_export", RequestContext.forUser("alice"), Map.of()),
                tool, ToolOptions.defaults()).get();

        assertEquals(List.of("ssn ***-**-6789"), result);
        assertEquals(AuditStatus.SUCCESS, auditSink.readRecent(1).get(0).getStatus());
    }

    @Test
    void asyncFailureCompletesWithOriginalCause() {
        IllegalArgumentException failure = new IllegalArgumentException("bad filter");
        AsyncGovernedTool tool = args -> CompletableFuture.failedFuture(failure);

        CompletableFuture<Object> future = middleware.invokeAsync(
                invocation("list_products", RequestContext.forUser("bob"), Map.of()), tool, ToolOptions.defaults());

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertSame(failure, e.getCause());
        assertEquals("bad filter", auditSink.readRecent(1).get(0).getError());
    }

    @Test
    void asyncDenialCompletesExceptionallyWithoutRunningTool() {
        AtomicBoolean executed = new AtomicBoolean();
        AsyncGovernedTool tool = args -> {
            executed.set(true);
            return CompletableFuture.completedFuture("x");
        };

        CompletableFuture<Object> future = middleware.invokeAsync(
                invocation("customer_export", RequestContext.forUser("bob"), Map.of()), tool, ToolOptions.defaults());

        ExecutionException e = assertThrows(ExecutionException.class, future::get);
        assertInstanceOf(SecurityPolicyException.class, e.getCause());
        assertEquals(FailedPolicy.PII_ACCESS, ((SecurityPolicyException) e.getCause()).getFailedPolicy());
        assertFalse(executed.get());
    }

    @Test
    void syncTimeoutIsAuditedAsError() {
        GovernedTool slow = args -> {
            Thread.sleep(5_000);
            return "late";
        };

        assertThrows(TimeoutException.class, () -> middleware.invoke(
                invocation("list_products", RequestContext.forUser("bob"), Map.of()),
                slow,
                ToolOptions.builder().timeout(Duration.ofMillis(50)).build()));

        assertEquals(AuditStatus.ERROR, auditSink.readRecent(1).get(0).getStatus());
    }

    @Test
    void governWrapsToolForRepeatedUse() throws Exception {
        GovernedTool governed = middleware.govern("list_products", args -> args.get("limit"), ToolOptions.defaults());

        assertEquals(3, governed.execute(Map.of("limit", 3)));
        assertEquals(2, auditSink.readRecent(0).size());
    }

    @Test
    void registryInvokesNamedToolsThroughMiddleware() throws Exception {
        GovernedToolRegistry registry = new GovernedToolRegistry(middleware, List.of(
                ToolDefinition.builder().name("list_products").tool(args -> List.of("widget")).build()
        ));

        assertEquals(List.of("widget"), registry.invoke("LIST_PRODUCTS", RequestContext.forUser("bob"), Map.of()));
        assertEquals(2, auditSink.readRecent(0).size());
        assertThrows(ToolNotFoundException.class, () -> registry.invoke("drop_tables", null, Map.of()));
    }

    private List<AuditEntry> chronological() {
        List<AuditEntry> recent = new ArrayList<>(auditSink.readRecent(0));
        Collections.reverse(recent);
        return recent;
    }

    private static ToolInvocation invocation(String toolName, RequestContext context, Map<String, Object> arguments) {
        return ToolInvocation.builder()
                .toolName(toolName)
                .context(context)
                .arguments(arguments)
                .build();
    }

    public record Contact(String name, String email) {
    }
}
