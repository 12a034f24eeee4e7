package com.datagate.governance;

import lombok.Builder;
import lombok.Value;

/**
 * A named tool registered for governed invocation.
 */
@Value
@Builder
public class ToolDefinition {
    String name;
    String description;
    GovernedTool tool;
    @Builder.Default
    ToolOptions options = ToolOptions.defaults();
}
