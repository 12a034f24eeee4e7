package com.datagate.governance;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ToolInvocation {
    String toolName;
    /** Explicit caller identity; when null it is read from the arguments. */
    RequestContext context;
    @Builder.Default
    Map<String, Object> arguments = Map.of();

    RequestContext resolveContext() {
        return context != null ? context : RequestContext.fromArguments(arguments);
    }
}
