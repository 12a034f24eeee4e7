package com.datagate.governance;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An asynchronous tool that can be wrapped by {@link GovernanceMiddleware}.
 */
@FunctionalInterface
public interface AsyncGovernedTool {
    CompletableFuture<?> execute(Map<String, Object> arguments);
}
