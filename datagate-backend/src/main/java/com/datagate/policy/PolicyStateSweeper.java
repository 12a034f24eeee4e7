package com.datagate.policy;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically drops expired validation cache entries and stale rate-limit timestamps.
 */
@Slf4j
@Component
public class PolicyStateSweeper {

    private final PolicyEngine policyEngine;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "policy-state-sweeper");
        t.setDaemon(true);
        return t;
    });

    public PolicyStateSweeper(
            PolicyEngine policyEngine,
            @Value("${datagate.policy.sweep-interval-seconds:60}") long sweepIntervalSeconds
    ) {
        this.policyEngine = policyEngine;
        long interval = Math.max(1, sweepIntervalSeconds);
        scheduler.scheduleWithFixedDelay(this::sweep, interval, interval, TimeUnit.SECONDS);
    }

    void sweep() {
        try {
            policyEngine.sweepExpired();
        } catch (RuntimeException e) {
            log.warn("Policy state sweep failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }
}
