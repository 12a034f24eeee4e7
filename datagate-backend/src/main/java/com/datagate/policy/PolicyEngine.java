package com.datagate.policy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Validates tool execution requests against the rate-limit, tenant (RLS), complexity and PII-access policies.
 *
 * <p>Checks run in that order and stop at the first failure. Every decision, allowed or denied, is cached
 * for the configured TTL under a hash of the request, and a cached decision is returned without running any
 * check (so it does not consume rate-limit capacity). Policy failures are returned, never thrown.
 *
 * <p>All state lives in concurrent maps owned by the instance. The rate-limit window of a user is pruned and
 * extended inside a single {@link ConcurrentHashMap#compute} call, which makes the read-modify-write atomic.
 */
@Slf4j
public class PolicyEngine {

    public static final int DEFAULT_MAX_CALLS_PER_HOUR = 100;
    public static final int DEFAULT_MAX_COMPLEXITY_SCORE = 100;
    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);

    static final Duration RATE_LIMIT_WINDOW = Duration.ofHours(1);

    private static final List<String> PII_INDICATORS = List.of(
            "customer",
            "user",
            "personal",
            "pii",
            "email",
            "phone",
            "ssn",
            "credit"
    );

    private static final List<String> ALL_CHECKS = List.of("rate_limit", "rls", "complexity", "pii_access");

    private final int maxCallsPerHour;
    private final int maxComplexityScore;
    private final Duration cacheTtl;
    private final Clock clock;
    private final ObjectMapper canonicalMapper;

    private final Map<String, Deque<Instant>> rateLimitWindows = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<String>> userTenants = new ConcurrentHashMap<>();
    private final Set<String> piiPermissions = ConcurrentHashMap.newKeySet();
    private final Map<String, CachedValidation> cache = new ConcurrentHashMap<>();

    /**
     * Create a policy engine with default limits.
     *
     * @param objectMapper Jackson object mapper used to canonicalize arguments
     */
    public PolicyEngine(ObjectMapper objectMapper) {
        this(DEFAULT_MAX_CALLS_PER_HOUR, DEFAULT_MAX_COMPLEXITY_SCORE, DEFAULT_CACHE_TTL, Clock.systemUTC(), objectMapper);
    }

    /**
     * Create a policy engine.
     *
     * @param maxCallsPerHour maximum allowed calls per user in the trailing hour
     * @param maxComplexityScore maximum allowed complexity score
     * @param cacheTtl how long a validation decision stays cached
     * @param clock clock used for rate limiting and cache expiry
     * @param objectMapper Jackson object mapper used to canonicalize arguments
     */
    public PolicyEngine(int maxCallsPerHour, int maxComplexityScore, Duration cacheTtl, Clock clock, ObjectMapper objectMapper) {
        this.maxCallsPerHour = maxCallsPerHour;
        this.maxComplexityScore = maxComplexityScore;
        this.cacheTtl = cacheTtl;
        this.clock = clock;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Validate a tool execution request.
     *
     * @param userId calling user
     * @param tenantId requested tenant, or null to skip the RLS check
     * @param toolName tool being called
     * @param arguments tool arguments
     * @return validation result (cached for the TTL)
     */
    public ValidationResult validate(String userId, String tenantId, String toolName, Map<String, Object> arguments) {
        Objects.requireNonNull(userId, "userId");
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        String cacheKey = cacheKey(userId, tenantId, toolName, args);

        boolean[] computed = new boolean[1];
        // identical concurrent requests share one computation
        CachedValidation entry = cache.compute(cacheKey, (k, existing) -> {
            if (existing != null && clock.instant().isBefore(existing.expiresAt())) {
                return existing;
            }
            computed[0] = true;
            return new CachedValidation(runChecks(userId, tenantId, toolName, args), clock.instant().plus(cacheTtl));
        });
        ValidationResult result = entry.result();
        if (!computed[0]) {
            log.debug("Validation cache hit (user_id={}, tool={}, allowed={})", userId, toolName, result.isAllowed());
            return result;
        }

        if (!result.isAllowed()) {
            log.info("Policy denied call (user_id={}, tenant_id={}, tool={}, failed_policy={})",
                    userId, tenantId, toolName, result.getFailedPolicy().code());
        }
        return result;
    }

    private ValidationResult runChecks(String userId, String tenantId, String toolName, Map<String, Object> arguments) {
        ValidationResult rateLimit = checkRateLimit(userId);
        if (!rateLimit.isAllowed()) {
            return rateLimit;
        }

        if (tenantId != null && !tenantId.isBlank()) {
            ValidationResult rls = checkRls(userId, tenantId);
            if (!rls.isAllowed()) {
                return rls;
            }
        }

        ValidationResult complexity = checkComplexity(arguments);
        if (!complexity.isAllowed()) {
            return complexity;
        }

        if (accessesPii(toolName, arguments)) {
            ValidationResult pii = checkPiiAccess(userId);
            if (!pii.isAllowed()) {
                return pii;
            }
        }

        return ValidationResult.pass("All policy checks passed", Map.of("checks_passed", ALL_CHECKS));
    }

    private ValidationResult checkRateLimit(String userId) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(RATE_LIMIT_WINDOW);
        RateLimitOutcome outcome = new RateLimitOutcome();

        rateLimitWindows.compute(userId, (k, existing) -> {
            Deque<Instant> window = existing != null ? existing : new ArrayDeque<>();
            prune(window, cutoff);
            outcome.callCount = window.size();
            if (window.size() >= maxCallsPerHour) {
                outcome.oldest = window.peekFirst();
            } else {
                window.addLast(now);
                outcome.allowed = true;
            }
            return window;
        });

        if (!outcome.allowed) {
            Instant retryAt = outcome.oldest != null ? outcome.oldest.plus(RATE_LIMIT_WINDOW) : now.plus(RATE_LIMIT_WINDOW);
            return ValidationResult.deny(
                    FailedPolicy.RATE_LIMIT,
                    "Rate limit exceeded: " + outcome.callCount + "/" + maxCallsPerHour + " calls per hour",
                    List.of(
                            "Wait until " + retryAt + " to retry",
                            "Contact administrator to request higher rate limit"
                    ),
                    Map.of("call_count", outcome.callCount, "limit", maxCallsPerHour)
            );
        }
        return ValidationResult.pass("Rate limit check passed",
                Map.of("call_count", outcome.callCount + 1, "limit", maxCallsPerHour));
    }

    private ValidationResult checkRls(String userId, String tenantId) {
        List<String> allowedTenants = allowedTenants(userId);
        if (allowedTenants.contains(tenantId)) {
            return ValidationResult.pass("RLS check passed", Map.of("user_id", userId, "tenant_id", tenantId));
        }
        return ValidationResult.deny(
                FailedPolicy.RLS,
                "RLS check failed: User '" + userId + "' cannot access tenant '" + tenantId + "'",
                List.of(
                        "Request access to tenant '" + tenantId + "' from administrator",
                        "Use one of your allowed tenants: " + (allowedTenants.isEmpty() ? "none" : String.join(", ", allowedTenants))
                ),
                Map.of("user_id", userId, "tenant_id", tenantId, "allowed_tenants", allowedTenants)
        );
    }

    private ValidationResult checkComplexity(Map<String, Object> arguments) {
        int score = complexityScore(arguments);
        if (score > maxComplexityScore) {
            return ValidationResult.deny(
                    FailedPolicy.COMPLEXITY,
                    "Complexity check failed: Score " + score + " exceeds maximum " + maxComplexityScore,
                    List.of(
                            "Simplify the query by reducing number of joins",
                            "Add filters to limit result set size",
                            "Split complex query into multiple simpler queries",
                            "Contact administrator to request higher complexity limit"
                    ),
                    Map.of("complexity_score", score, "max_score", maxComplexityScore)
            );
        }
        return ValidationResult.pass("Complexity check passed", Map.of("complexity_score", score));
    }

    private ValidationResult checkPiiAccess(String userId) {
        if (hasPiiPermission(userId)) {
            return ValidationResult.pass("PII access check passed", Map.of("user_id", userId, "has_pii_permission", true));
        }
        return ValidationResult.deny(
                FailedPolicy.PII_ACCESS,
                "PII access check failed: User does not have PII_READ permission",
                List.of(
                        "Request PII_READ permission from administrator",
                        "Use a tool that does not access PII data"
                ),
                Map.of("user_id", userId, "has_pii_permission", false)
        );
    }

    /**
     * Score a call: base 10, +1 per 100 characters of the {@code query} argument, +5 per argument and +10 per
     * nesting level (the argument map itself counts as the first level).
     *
     * @param arguments tool arguments
     * @return complexity score
     */
    int complexityScore(Map<String, Object> arguments) {
        int score = 10;
        if (arguments.containsKey("query")) {
            Object query = arguments.get("query");
            String text = query instanceof String s ? s : toJson(query);
            score += text.length() / 100;
        }
        score += arguments.size() * 5;
        score += nestingDepth(arguments, 0) * 10;
        return score;
    }

    private static int nestingDepth(Object value, int depth) {
        Collection<?> children;
        if (value instanceof Map<?, ?> map) {
            children = map.values();
        } else if (value instanceof Collection<?> collection) {
            children = collection;
        } else {
            return depth;
        }
        int max = depth;
        for (Object child : children) {
            max = Math.max(max, nestingDepth(child, depth + 1));
        }
        return max;
    }

    boolean accessesPii(String toolName, Map<String, Object> arguments) {
        String tool = toolName != null ? toolName.toLowerCase(Locale.ROOT) : "";
        String args = toJson(arguments).toLowerCase(Locale.ROOT);
        for (String indicator : PII_INDICATORS) {
            if (tool.contains(indicator) || args.contains(indicator)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Drop expired cache entries and rate-limit timestamps older than the window. Users whose window becomes
     * empty are removed.
     *
     * @return number of cache entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = cache.size();
        cache.entrySet().removeIf(e -> !e.getValue().expiresAt().isAfter(now));
        int removed = Math.max(0, before - cache.size());

        Instant cutoff = now.minus(RATE_LIMIT_WINDOW);
        for (String userId : rateLimitWindows.keySet()) {
            rateLimitWindows.computeIfPresent(userId, (k, window) -> {
                prune(window, cutoff);
                return window.isEmpty() ? null : window;
            });
        }
        if (removed > 0) {
            log.debug("Swept {} expired validation cache entries", removed);
        }
        return removed;
    }

    /**
     * Drop all cached decisions. Grants changed through the administrative methods only affect requests
     * that are not already cached.
     */
    public void invalidateCache() {
        cache.clear();
    }

    public void grantTenantAccess(String userId, String tenantId) {
        userTenants.computeIfAbsent(userId, k -> new CopyOnWriteArrayList<>()).addIfAbsent(tenantId);
        log.info("Granted tenant access (user_id={}, tenant_id={})", userId, tenantId);
    }

    public void revokeTenantAccess(String userId, String tenantId) {
        List<String> tenants = userTenants.get(userId);
        if (tenants != null) {
            tenants.remove(tenantId);
        }
        log.info("Revoked tenant access (user_id={}, tenant_id={})", userId, tenantId);
    }

    public void grantPiiPermission(String userId) {
        piiPermissions.add(userId);
        log.info("Granted PII_READ permission (user_id={})", userId);
    }

    public void revokePiiPermission(String userId) {
        piiPermissions.remove(userId);
        log.info("Revoked PII_READ permission (user_id={})", userId);
    }

    public List<String> allowedTenants(String userId) {
        List<String> tenants = userTenants.get(userId);
        return tenants != null ? List.copyOf(tenants) : List.of();
    }

    public boolean hasPiiPermission(String userId) {
        return userId != null && piiPermissions.contains(userId);
    }

    int cacheSize() {
        return cache.size();
    }

    int recordedCalls(String userId) {
        int[] count = new int[1];
        rateLimitWindows.computeIfPresent(userId, (k, window) -> {
            count[0] = window.size();
            return window;
        });
        return count[0];
    }

    private String cacheKey(String userId, String tenantId, String toolName, Map<String, Object> arguments) {
        Map<String, Object> keyData = new LinkedHashMap<>();
        keyData.put("user_id", userId);
        keyData.put("tenant_id", tenantId);
        keyData.put("tool_name", toolName);
        keyData.put("arguments", arguments);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(toJson(keyData).getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private String toJson(Object value) {
        try {
            return canonicalMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize policy input, falling back to toString: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    private static void prune(Deque<Instant> window, Instant cutoff) {
        while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
            window.removeFirst();
        }
    }

    private record CachedValidation(ValidationResult result, Instant expiresAt) {
    }

    private static final class RateLimitOutcome {
        private boolean allowed;
        private int callCount;
        private Instant oldest;
    }
}
