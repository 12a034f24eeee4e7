package com.datagate.governance;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named tools that are always invoked through the {@link GovernanceMiddleware}.
 */
@Slf4j
public class GovernedToolRegistry {

    private final GovernanceMiddleware middleware;
    private final Map<String, ToolDefinition> tools = new ConcurrentHashMap<>();

    public GovernedToolRegistry(GovernanceMiddleware middleware, Collection<ToolDefinition> definitions) {
        this.middleware = middleware;
        if (definitions != null) {
            for (ToolDefinition definition : definitions) {
                register(definition);
            }
        }
    }

    public void register(ToolDefinition definition) {
        if (definition == null || definition.getName() == null || definition.getName().isBlank()) {
            throw new IllegalArgumentException("Tool definition must have a name");
        }
        String key = normalize(definition.getName());
        ToolDefinition previous = tools.put(key, definition);
        if (previous != null) {
            log.warn("Replaced governed tool definition (tool={})", definition.getName());
        } else {
            log.info("Registered governed tool (tool={})", definition.getName());
        }
    }

    public List<ToolDefinition> list() {
        List<ToolDefinition> out = new ArrayList<>(tools.values());
        out.sort((a, b) -> a.getName().compareToIgnoreCase(b.getName()));
        return out;
    }

    public ToolDefinition get(String name) {
        ToolDefinition definition = name != null ? tools.get(normalize(name)) : null;
        if (definition == null) {
            throw new ToolNotFoundException("Tool not found: " + name);
        }
        return definition;
    }

    /**
     * Invoke a registered tool.
     *
     * @param name tool name
     * @param context caller identity, or null to read it from the arguments
     * @param arguments tool arguments
     * @return masked result
     * @throws ToolNotFoundException when no tool has that name
     * @throws SecurityPolicyException when the call is denied
     * @throws Exception whatever the tool throws
     */
    public Object invoke(String name, RequestContext context, Map<String, Object> arguments) throws Exception {
        ToolDefinition definition = get(name);
        ToolInvocation invocation = ToolInvocation.builder()
                .toolName(definition.getName())
                .context(context)
                .arguments(arguments != null ? arguments : Map.of())
                .build();
        return middleware.invoke(invocation, definition.getTool(), definition.getOptions());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
