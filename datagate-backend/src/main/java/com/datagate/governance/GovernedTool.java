package com.datagate.governance;

import java.util.Map;

/**
 * A synchronous tool that can be wrapped by {@link GovernanceMiddleware}.
 */
@FunctionalInterface
public interface GovernedTool {
    Object execute(Map<String, Object> arguments) throws Exception;
}
