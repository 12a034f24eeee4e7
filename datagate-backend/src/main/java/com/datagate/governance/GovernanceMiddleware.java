package com.datagate.governance;

import com.datagate.audit.AuditEntry;
import com.datagate.audit.AuditSink;
import com.datagate.audit.AuditStatus;
import com.datagate.masking.PiiMasker;
import com.datagate.policy.PolicyEngine;
import com.datagate.policy.ValidationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tools under governance: policy validation, execution, PII masking of the result and auditing.
 *
 * <p>Every call writes an {@code attempt} audit entry before anything else happens, followed by exactly one
 * {@code success} or {@code error} entry. Denied calls raise {@link SecurityPolicyException} without running
 * the tool. Exceptions from the tool itself are audited and rethrown unchanged, except a
 * {@link SecurityPolicyException} from a nested governed call, which was audited by that call.
 */
@Slf4j
public class GovernanceMiddleware implements AutoCloseable {

    private static final String MDC_TRACE_ID = "trace_id";

    private final PolicyEngine policyEngine;
    private final PiiMasker piiMasker;
    private final AuditSink auditSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ExecutorService toolExecutor;

    public GovernanceMiddleware(PolicyEngine policyEngine, PiiMasker piiMasker, AuditSink auditSink, ObjectMapper objectMapper) {
        this(policyEngine, piiMasker, auditSink, objectMapper, Clock.systemUTC());
    }

    public GovernanceMiddleware(
            PolicyEngine policyEngine,
            PiiMasker piiMasker,
            AuditSink auditSink,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.policyEngine = policyEngine;
        this.piiMasker = piiMasker;
        this.auditSink = auditSink;
        this.objectMapper = objectMapper;
        this.clock = clock;
        AtomicInteger threadIndex = new AtomicInteger();
        this.toolExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "governed-tool-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Invoke a synchronous tool under governance.
     *
     * @param invocation tool name, caller context and arguments
     * @param tool tool to run
     * @param options governance options
     * @return masked tool result
     * @throws SecurityPolicyException when the call is denied
     * @throws Exception whatever the tool throws, unchanged
     */
    public Object invoke(ToolInvocation invocation, GovernedTool tool, ToolOptions options) throws Exception {
        String previousTraceId = MDC.get(MDC_TRACE_ID);
        MDC.put(MDC_TRACE_ID, newTraceId());
        try {
            ToolOptions resolved = options != null ? options : ToolOptions.defaults();
            RequestContext context = authorize(invocation, resolved);

            long start = System.nanoTime();
            Object result;
            try {
                result = execute(tool, invocation.getArguments(), resolved.getTimeout());
            } catch (SecurityPolicyException e) {
                // denied by a nested governed call, already audited there
                throw e;
            } catch (Exception e) {
                auditFailure(invocation, context, e, elapsedMs(start));
                throw e;
            }
            return auditSuccess(invocation, context, result, resolved, elapsedMs(start));
        } finally {
            restoreTraceId(previousTraceId);
        }
    }

    /**
     * Invoke an asynchronous tool under governance. Validation and the attempt audit entry happen before this
     * method returns; the outcome entry is written when the tool's future completes.
     *
     * @param invocation tool name, caller context and arguments
     * @param tool tool to run
     * @param options governance options
     * @return future of the masked result; completes exceptionally with {@link SecurityPolicyException} when
     *     denied, or with the tool's original exception
     */
    public CompletableFuture<Object> invokeAsync(ToolInvocation invocation, AsyncGovernedTool tool, ToolOptions options) {
        String traceId = newTraceId();
        String previousTraceId = MDC.get(MDC_TRACE_ID);
        MDC.put(MDC_TRACE_ID, traceId);
        try {
            ToolOptions resolved = options != null ? options : ToolOptions.defaults();
            RequestContext context;
            try {
                context = authorize(invocation, resolved);
            } catch (SecurityPolicyException e) {
                return CompletableFuture.failedFuture(e);
            }

            long start = System.nanoTime();
            CompletableFuture<?> future;
            try {
                CompletableFuture<?> started = tool.execute(invocation.getArguments());
                future = started != null ? started.copy() : CompletableFuture.completedFuture(null);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            if (resolved.getTimeout() != null) {
                future = future.orTimeout(resolved.getTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }

            CompletableFuture<Object> outcome = new CompletableFuture<>();
            future.whenComplete((result, error) -> {
                String callerTraceId = MDC.get(MDC_TRACE_ID);
                MDC.put(MDC_TRACE_ID, traceId);
                try {
                    if (error != null) {
                        Throwable cause = unwrap(error);
                        if (!(cause instanceof SecurityPolicyException)) {
                            auditFailure(invocation, context, cause, elapsedMs(start));
                        }
                        outcome.completeExceptionally(cause);
                    } else {
                        outcome.complete(auditSuccess(invocation, context, result, resolved, elapsedMs(start)));
                    }
                } catch (RuntimeException e) {
                    outcome.completeExceptionally(e);
                } finally {
                    restoreTraceId(callerTraceId);
                }
            });
            return outcome;
        } finally {
            restoreTraceId(previousTraceId);
        }
    }

    /**
     * Wrap a tool so every call goes through {@link #invoke}. The caller context is read from the arguments.
     *
     * @param toolName name used for policy checks and auditing
     * @param tool tool to wrap
     * @param options governance options
     * @return governed tool
     */
    public GovernedTool govern(String toolName, GovernedTool tool, ToolOptions options) {
        return arguments -> invoke(
                ToolInvocation.builder().toolName(toolName).arguments(arguments != null ? arguments : Map.of()).build(),
                tool,
                options
        );
    }

    private RequestContext authorize(ToolInvocation invocation, ToolOptions options) {
        RequestContext context = invocation.resolveContext();
        if (options.isRequiresPii()) {
            log.debug("Tool declares PII access (tool={}, user_id={})", invocation.getToolName(), context.getUserId());
        }

        ValidationResult validation = policyEngine.validate(
                context.getUserId(),
                context.getTenantId(),
                invocation.getToolName(),
                invocation.getArguments()
        );

        auditSink.append(baseEntry(invocation, context)
                .validation(validation)
                .status(AuditStatus.ATTEMPT)
                .build());

        if (!validation.isAllowed()) {
            String message = "Security policy violation: " + validation.getReason();
            auditSink.append(baseEntry(invocation, context)
                    .error(message)
                    .status(AuditStatus.ERROR)
                    .build());
            log.warn("Governed call denied (tool={}, user_id={}, failed_policy={}, reason={})",
                    invocation.getToolName(), context.getUserId(), validation.getFailedPolicy().code(), validation.getReason());
            throw new SecurityPolicyException(message, validation);
        }
        return context;
    }

    private Object execute(GovernedTool tool, Map<String, Object> arguments, Duration timeout) throws Exception {
        if (timeout == null) {
            return tool.execute(arguments);
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<Object> future = toolExecutor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return tool.execute(arguments);
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    private Object auditSuccess(
            ToolInvocation invocation,
            RequestContext context,
            Object result,
            ToolOptions options,
            long elapsedMs
    ) {
        Object masked = piiMasker.mask(toJsonLike(result), options.getSensitivityLevel());
        auditSink.append(baseEntry(invocation, context)
                .result(masked)
                .executionTimeMs(elapsedMs)
                .status(AuditStatus.SUCCESS)
                .build());
        log.info("Governed call succeeded (tool={}, user_id={}, elapsed_ms={})",
                invocation.getToolName(), context.getUserId(), elapsedMs);
        return masked;
    }

    private void auditFailure(ToolInvocation invocation, RequestContext context, Throwable error, long elapsedMs) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        auditSink.append(baseEntry(invocation, context)
                .error(message)
                .executionTimeMs(elapsedMs)
                .status(AuditStatus.ERROR)
                .build());
        log.error("Governed call failed (tool={}, user_id={}, elapsed_ms={}, arguments={}): {}",
                invocation.getToolName(), context.getUserId(), elapsedMs, invocation.getArguments(), message);
    }

    private AuditEntry.AuditEntryBuilder baseEntry(ToolInvocation invocation, RequestContext context) {
        return AuditEntry.builder()
                .timestamp(clock.instant())
                .userId(context.getUserId())
                .tenantId(context.getTenantId())
                .toolName(invocation.getToolName())
                .arguments(invocation.getArguments());
    }

    private Object toJsonLike(Object result) {
        if (result instanceof CharSequence && !(result instanceof String)) {
            return result.toString();
        }
        if (result == null
                || result instanceof Map<?, ?>
                || result instanceof Collection<?>
                || result instanceof Object[]
                || result instanceof String
                || result instanceof Number
                || result instanceof Boolean) {
            return result;
        }
        try {
            return objectMapper.convertValue(result, Object.class);
        } catch (IllegalArgumentException e) {
            log.warn("Could not convert tool result of type {} for masking: {}", result.getClass().getName(), e.getMessage());
            return result;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    private static void restoreTraceId(String previous) {
        if (previous != null) {
            MDC.put(MDC_TRACE_ID, previous);
        } else {
            MDC.remove(MDC_TRACE_ID);
        }
    }

    @Override
    public void close() {
        toolExecutor.shutdownNow();
    }
}
