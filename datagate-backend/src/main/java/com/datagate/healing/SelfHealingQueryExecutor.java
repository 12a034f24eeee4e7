package com.datagate.healing;

import com.datagate.ontology.LearnedMappingStore;
import com.datagate.oracle.ColumnOracle;
import com.datagate.sql.ColumnNotFoundException;
import com.datagate.sql.SqlBackend;
import com.datagate.sql.TableNotFoundException;
import com.datagate.sql.TypeMismatchException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@code SELECT column FROM table [WHERE filter]} and repairs the query when the column does not exist.
 *
 * <p>On a missing column the executor gathers semantic alternatives, asks the {@link ColumnOracle} to pick
 * one, rewrites the query and retries, up to {@code maxRetries} times. A successful repair is remembered in
 * the {@link LearnedMappingStore}, and later calls for the same table and column use the remembered column
 * from the start. Missing tables, type mismatches and other errors end the call at once.
 *
 * <p>The outcome is always returned as a {@link HealingResult}; nothing is thrown to the caller.
 */
@Slf4j
public class SelfHealingQueryExecutor implements AutoCloseable {

    public static final int DEFAULT_MAX_RETRIES = 2;

    private final SqlBackend sqlBackend;
    private final SemanticColumnMatcher matcher;
    private final LearnedMappingStore learnedMappings;
    private final ColumnOracle oracle;
    private final int maxRetries;
    private final Duration oracleTimeout;
    private final ExecutorService oracleExecutor;

    public SelfHealingQueryExecutor(
            SqlBackend sqlBackend,
            SemanticColumnMatcher matcher,
            LearnedMappingStore learnedMappings,
            ColumnOracle oracle,
            int maxRetries,
            Duration oracleTimeout
    ) {
        this.sqlBackend = sqlBackend;
        this.matcher = matcher;
        this.learnedMappings = learnedMappings;
        this.oracle = oracle;
        this.maxRetries = Math.max(0, maxRetries);
        this.oracleTimeout = oracleTimeout;
        AtomicInteger threadIndex = new AtomicInteger();
        this.oracleExecutor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "column-oracle-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Query a single column, healing the query if the column has been renamed.
     *
     * @param table table name
     * @param column requested column
     * @param filter optional WHERE clause body
     * @return result with rows on success, or the reason for failure; always carries the healing history
     */
    public HealingResult queryWithHealing(String table, String column, String filter) {
        String learnedColumn = learnedMappings.find(table, column)
                .filter(mapped -> !mapped.equalsIgnoreCase(column))
                .orElse(null);
        String query = QueryRewriter.buildQuery(table, learnedColumn != null ? learnedColumn : column, filter);
        if (learnedColumn != null) {
            log.info("Applying learned column mapping (table={}, column={}, mapped_to={})", table, column, learnedColumn);
        }

        String currentColumn = learnedColumn != null ? learnedColumn : column;
        List<HealingAttempt> history = new ArrayList<>();
        String lastError = null;
        int attempt = 0;

        while (attempt <= maxRetries) {
            attempt++;
            try {
                List<Map<String, Object>> rows = sqlBackend.execute(query);
                if (!history.isEmpty()) {
                    HealingAttempt last = history.get(history.size() - 1);
                    saveMapping(table, last.getFailedColumn(), last.getSuggestedColumn());
                    if (learnedColumn != null) {
                        // the mapping applied up front is stale; point the requested column at the working one
                        saveMapping(table, column, last.getSuggestedColumn());
                    }
                    log.info("Query healed (table={}, attempts={}, query={})", table, attempt, query);
                }
                return HealingResult.builder()
                        .success(true)
                        .query(query)
                        .result(rows)
                        .attempt(attempt)
                        .healingApplied(!history.isEmpty())
                        .healingHistory(history)
                        .learnedMappingApplied(learnedColumn)
                        .build();
            } catch (ColumnNotFoundException e) {
                lastError = e.getMessage();
                String failedColumn = resolveFailedColumn(e.getColumn(), currentColumn);

                boolean alreadyTried = history.stream().anyMatch(h -> h.getFailedColumn().equalsIgnoreCase(failedColumn));
                if (alreadyTried) {
                    log.warn("Healing loop detected (table={}, column={})", table, failedColumn);
                    return failure(query, attempt, lastError, history, learnedColumn,
                            "Healing loop detected: column '" + failedColumn + "' was already replaced");
                }

                List<String> alternatives = matcher.findAlternatives(failedColumn, table);
                if (alternatives.isEmpty()) {
                    log.info("No semantic alternatives (table={}, column={})", table, failedColumn);
                    return terminal(query, attempt, lastError, history, learnedColumn, "No semantic alternatives found");
                }

                HealingAttempt healing = chooseReplacement(failedColumn, table, alternatives, lastError);
                query = QueryRewriter.replaceColumn(query, failedColumn, healing.getSuggestedColumn());
                currentColumn = healing.getSuggestedColumn();
                history.add(healing);
                log.info("Retrying with healed column (table={}, failed_column={}, suggested_column={}, attempt={})",
                        table, failedColumn, healing.getSuggestedColumn(), attempt);
            } catch (TableNotFoundException e) {
                return terminal(query, attempt, e.getMessage(), history, learnedColumn, "Table not found - cannot heal");
            } catch (TypeMismatchException e) {
                return terminal(query, attempt, e.getMessage(), history, learnedColumn, "Type mismatch - cannot heal");
            } catch (Exception e) {
                log.error("Query failed without healing (table={}, query={}): {}", table, query, e.getMessage(), e);
                return terminal(query, attempt, e.getMessage(), history, learnedColumn,
                        "Unexpected error: " + e.getClass().getSimpleName());
            }
        }

        log.warn("Healing gave up after {} attempts (table={}, column={})", attempt, table, column);
        return failure(query, attempt, lastError != null ? lastError : "Unknown error", history, learnedColumn,
                "Max retries exceeded");
    }

    private HealingAttempt chooseReplacement(String failedColumn, String table, List<String> alternatives, String errorMessage) {
        String prompt = HealingPrompts.buildPrompt(failedColumn, table, alternatives, errorMessage);
        String raw = null;
        String suggested = null;
        try {
            raw = askOracle(prompt);
            suggested = HealingPrompts.matchAlternative(HealingPrompts.parseSuggestion(raw), alternatives);
            if (suggested == null) {
                log.debug("Oracle reply not among alternatives, using first alternative (reply={})", raw);
            }
        } catch (Exception e) {
            log.warn("Column oracle unavailable, using first alternative (table={}, column={}): {}",
                    table, failedColumn, e.getMessage());
        }

        return HealingAttempt.builder()
                .failedColumn(failedColumn)
                .alternatives(List.copyOf(alternatives))
                .suggestedColumn(suggested != null ? suggested : alternatives.get(0))
                .oracleRawResponse(raw)
                .build();
    }

    private String askOracle(String prompt) throws Exception {
        Future<String> future = oracleExecutor.submit(() -> oracle.request(prompt, HealingPrompts.SYSTEM_PROMPT));
        try {
            if (oracleTimeout == null || oracleTimeout.isZero() || oracleTimeout.isNegative()) {
                return future.get();
            }
            return future.get(oracleTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Oracle did not answer within " + oracleTimeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            throw cause instanceof Exception ex ? ex : e;
        }
    }

    private void saveMapping(String table, String failedColumn, String suggestedColumn) {
        try {
            learnedMappings.save(table, failedColumn, suggestedColumn);
        } catch (RuntimeException e) {
            log.warn("Could not save learned mapping (table={}, failed_column={}): {}", table, failedColumn, e.getMessage());
        }
    }

    private static String resolveFailedColumn(String reported, String requested) {
        if (reported == null || reported.isBlank()) {
            return requested;
        }
        return reported.equalsIgnoreCase(requested) ? requested : reported;
    }

    private static HealingResult terminal(
            String query,
            int attempt,
            String error,
            List<HealingAttempt> history,
            String learnedColumn,
            String message
    ) {
        return HealingResult.builder()
                .success(false)
                .query(query)
                .attempt(attempt)
                .healingApplied(false)
                .healingHistory(history)
                .error(error)
                .message(message)
                .learnedMappingApplied(learnedColumn)
                .build();
    }

    private static HealingResult failure(
            String query,
            int attempt,
            String error,
            List<HealingAttempt> history,
            String learnedColumn,
            String message
    ) {
        return HealingResult.builder()
                .success(false)
                .query(query)
                .attempt(attempt)
                .healingApplied(!history.isEmpty())
                .healingHistory(history)
                .error(error)
                .message(message)
                .learnedMappingApplied(learnedColumn)
                .build();
    }

    @Override
    public void close() {
        oracleExecutor.shutdownNow();
    }
}
