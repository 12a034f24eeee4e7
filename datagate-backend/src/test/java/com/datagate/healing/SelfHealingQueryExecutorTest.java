package com.datagate.healing;

import com.datagate.ontology.ColumnOntology;
import com.datagate.ontology.InMemoryLearnedMappingStore;
import com.datagate.oracle.ColumnOracle;
import com.datagate.oracle.OracleUnavailableException;
import com.datagate.sql.TypeMismatchException;
import com.datagate.support.InMemorySqlBackend;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class SelfHealingQueryExecutorTest {

    private InMemorySqlBackend backend;
    private InMemoryLearnedMappingStore learned;
    private ColumnOracle oracle;
    private SelfHealingQueryExecutor executor;

    @BeforeEach
    void setUp() {
        backend = new InMemorySqlBackend();
        learned = new InMemoryLearnedMappingStore();
        oracle = mock(ColumnOracle.class);
        SemanticColumnMatcher matcher = new SemanticColumnMatcher(
                ColumnOntology.fromClasspath("column_ontology.json", new ObjectMapper()), learned);
        executor = new SelfHealingQueryExecutor(backend, matcher, learned, oracle, 2, Duration.ofMillis(500));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void healsRenamedColumnAndRemembersIt() throws Exception {
        when(oracle.request(anyString(), anyString())).thenReturn("vat_number");

        HealingResult result = executor.queryWithHealing("customers", "tax_id", null);

        assertTrue(result.isSuccess());
        assertTrue(result.isHealingApplied());
        assertEquals(2, result.getAttempt());
        assertEquals("SELECT vat_number FROM customers", result.getQuery());
        assertEquals(2, result.getResult().size());
        assertEquals("VAT123", result.getResult().get(0).get("vat_number"));
        assertNull(result.getLearnedMappingApplied());

        HealingAttempt step = result.getHealingHistory().get(0);
        assertEquals("tax_id", step.getFailedColumn());
        assertEquals("vat_number", step.getSuggestedColumn());
        assertEquals("vat_number", step.getOracleRawResponse());
        assertEquals(List.of("vat_number", "vat_id", "tax_number", "tin", "ein"), step.getAlternatives());
        assertEquals(Map.of("customers", Map.of("tax_id", "vat_number")), learned.getAll());
    }

    @Test
    void secondCallUsesLearnedMappingWithoutOracle() throws Exception {
        when(oracle.request(anyString(), anyString())).thenReturn("vat_number");
        executor.queryWithHealing("customers", "tax_id", null);

        HealingResult result = executor.queryWithHealing("customers", "tax_id", "id = 1");

        assertTrue(result.isSuccess());
        assertFalse(result.isHealingApplied());
        assertEquals(1, result.getAttempt());
        assertEquals("vat_number", result.getLearnedMappingApplied());
        assertEquals("SELECT vat_number FROM customers WHERE id = 1", result.getQuery());
        assertTrue(result.getHealingHistory().isEmpty());
        verify(oracle, times(1)).request(anyString(), anyString());
    }

    @Test
    void staleLearnedMappingIsRefreshedForRequestedColumn() throws Exception {
        learned.save("customers", "tax_id", "vat_id");
        when(oracle.request(anyString(), anyString())).thenReturn("vat_number");

        HealingResult healed = executor.queryWithHealing("customers", "tax_id", null);

        assertTrue(healed.isSuccess());
        assertEquals("vat_id", healed.getLearnedMappingApplied());
        assertEquals("vat_id", healed.getHealingHistory().get(0).getFailedColumn());
        assertEquals(Optional.of("vat_number"), learned.find("customers", "tax_id"));
        assertEquals(Optional.of("vat_number"), learned.find("customers", "vat_id"));

        HealingResult next = executor.queryWithHealing("customers", "tax_id", null);

        assertTrue(next.isSuccess());
        assertEquals(1, next.getAttempt());
        assertEquals("vat_number", next.getLearnedMappingApplied());
        verify(oracle, times(1)).request(anyString(), anyString());
    }

    @Test
    void unavailableOracleFallsBackToFirstAlternative() throws Exception {
        when(oracle.request(anyString(), anyString())).thenThrow(new OracleUnavailableException("no api key"));

        HealingResult result = executor.queryWithHealing("customers", "tax_id", null);

        assertTrue(result.isSuccess());
        assertEquals("vat_number", result.getHealingHistory().get(0).getSuggestedColumn());
        assertNull(result.getHealingHistory().get(0).getOracleRawResponse());
    }

    @Test
    void slowOracleFallsBackToFirstAlternative() throws Exception {
        when(oracle.request(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return "tin";
        });

        long start = System.nanoTime();
        HealingResult result = executor.queryWithHealing("customers", "tax_id", null);

        assertTrue(result.isSuccess());
        assertEquals("vat_number", result.getHealingHistory().get(0).getSuggestedColumn());
        assertTrue(Duration.ofNanos(System.nanoTime() - start).toMillis() < 4_000);
    }

    @Test
    void replyOutsideAlternativesFallsBackButIsKept() throws Exception {
        when(oracle.request(anyString(), anyString())).thenReturn("customer_tax_code");

        HealingResult result = executor.queryWithHealing("customers", "tax_id", null);

        HealingAttempt step = result.getHealingHistory().get(0);
        assertTrue(result.isSuccess());
        assertEquals("vat_number", step.getSuggestedColumn());
        assertEquals("customer_tax_code", step.getOracleRawResponse());
    }

    @Test
    void keepsLeadingCapitalWhenRewriting() throws Exception {
        when(oracle.request(anyString(), anyString())).thenReturn("vat_number");

        HealingResult result = executor.queryWithHealing("customers", "Tax_ID", "id = 1");

        assertTrue(result.isSuccess());
        assertEquals("SELECT Vat_number FROM customers WHERE id = 1", result.getQuery());
        assertEquals("Tax_ID", result.getHealingHistory().get(0).getFailedColumn());
    }

    @Test
    void missingTableIsTerminal() {
        HealingResult result = executor.queryWithHealing("invoices", "total", null);

        assertFalse(result.isSuccess());
        assertFalse(result.isHealingApplied());
        assertEquals(1, result.getAttempt());
        assertEquals("Table not found - cannot heal", result.getMessage());
        assertNotNull(result.getError());
        verifyNoInteractions(oracle);
    }

    @Test
    void typeMismatchIsTerminal() {
        backend.failNextWith(new TypeMismatchException("cannot compare text with integer"));

        HealingResult result = executor.queryWithHealing("customers", "name", "id = 'x'");

        assertFalse(result.isSuccess());
        assertEquals("Type mismatch - cannot heal", result.getMessage());
        assertEquals("cannot compare text with integer", result.getError());
        assertEquals(1, backend.getExecutedQueries().size());
    }

    @Test
    void otherDatabaseErrorsAreTerminal() {
        backend.failNextWith(new SQLException("connection reset", "08006"));

        HealingResult result = executor.queryWithHealing("customers", "name", null);

        assertFalse(result.isSuccess());
        assertEquals("Unexpected error: SQLException", result.getMessage());
        assertEquals("connection reset", result.getError());
    }

    @Test
    void columnWithoutAlternativesIsTerminal() {
        HealingResult result = executor.queryWithHealing("customers", "zzz_qq", null);

        assertFalse(result.isSuccess());
        assertFalse(result.isHealingApplied());
        assertEquals(1, result.getAttempt());
        assertEquals("No semantic alternatives found", result.getMessage());
        verifyNoInteractions(oracle);
    }

    @Test
    void givesUpAfterMaxRetries() throws Exception {
        when(oracle.request(anyString(), anyString())).thenReturn("sales_region", "territory", "area");

        HealingResult result = executor.queryWithHealing("products", "region", null);

        assertFalse(result.isSuccess());
        assertTrue(result.isHealingApplied());
        assertEquals("Max retries exceeded", result.getMessage());
        assertEquals(3, result.getAttempt());
        assertEquals(3, result.getHealingHistory().size());
        assertEquals("SELECT area FROM products", result.getQuery());
        assertEquals(3, backend.getExecutedQueries().size());
        assertTrue(learned.getAll().isEmpty());
    }

    @Test
    void stopsWhenAColumnComesBack() throws Exception {
        // vat_id does not exist either; its alternatives exclude itself, so the fallback goes back to tax_id
        when(oracle.request(anyString(), anyString())).thenReturn("The correct column name: `vat_id`");

        HealingResult result = executor.queryWithHealing("customers", "tax_id", null);

        assertFalse(result.isSuccess());
        assertTrue(result.getMessage().startsWith("Healing loop detected"));
        assertEquals(3, result.getAttempt());
        assertEquals(List.of("tax_id", "vat_id"),
                result.getHealingHistory().stream().map(HealingAttempt::getFailedColumn).toList());
    }
}
