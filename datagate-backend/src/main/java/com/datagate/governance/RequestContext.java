package com.datagate.governance;

import lombok.Value;

import java.util.Map;

/**
 * Identity of the caller on whose behalf a tool runs.
 */
@Value
public class RequestContext {

    public static final String DEFAULT_USER = "default_user";

    String userId;
    String tenantId;

    public RequestContext(String userId, String tenantId) {
        this.userId = userId == null || userId.isBlank() ? DEFAULT_USER : userId;
        this.tenantId = tenantId == null || tenantId.isBlank() ? null : tenantId;
    }

    public static RequestContext of(String userId, String tenantId) {
        return new RequestContext(userId, tenantId);
    }

    public static RequestContext forUser(String userId) {
        return new RequestContext(userId, null);
    }

    /**
     * Read {@code user_id} and {@code tenant_id} from a tool's argument map.
     *
     * @param arguments tool arguments, may be null
     * @return context, with the default user when the map does not name one
     */
    public static RequestContext fromArguments(Map<String, Object> arguments) {
        if (arguments == null) {
            return new RequestContext(null, null);
        }
        return new RequestContext(stringValue(arguments.get("user_id")), stringValue(arguments.get("tenant_id")));
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}
