package com.datagate.oracle;

import org.springframework.core.env.Environment;

import java.util.Locale;

/**
 * Immutable Portkey gateway configuration, read from {@code datagate.oracle.portkey.*} properties with
 * {@code PORTKEY_*} environment variables as fallback. An optional profile selects suffixed variants,
 * e.g. {@code PORTKEY_MODEL_FAST}.
 */
record PortkeyConfig(
        String baseUrl,
        String apiKey,
        String provider,
        String model,
        int timeoutMs
) {
    static final String DEFAULT_BASE_URL = "https://api.portkey.ai";
    static final int DEFAULT_TIMEOUT_MS = 30000;

    static PortkeyConfig fromEnvironment(Environment environment) {
        String profile = getTrimmed(environment, "datagate.oracle.portkey.profile", "PORTKEY_PROFILE");
        String apiKey = getTrimmed(environment, "datagate.oracle.portkey.api-key", "PORTKEY_API_KEY");

        String baseUrl = resolveProfileValue(environment, "datagate.oracle.portkey.base-url", "PORTKEY_BASE_URL", profile);
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        }
        String provider = resolveProfileValue(environment, "datagate.oracle.portkey.virtual-key", "PORTKEY_VIRTUAL_KEY", profile);
        String model = resolveProfileValue(environment, "datagate.oracle.portkey.model", "PORTKEY_MODEL", profile);

        int timeoutMs = DEFAULT_TIMEOUT_MS;
        String timeoutRaw = getTrimmed(environment, "datagate.oracle.portkey.timeout-ms", "PORTKEY_TIMEOUT_MS");
        if (timeoutRaw != null && !timeoutRaw.isBlank()) {
            try {
                timeoutMs = Integer.parseInt(timeoutRaw);
            } catch (NumberFormatException ignored) {
                // Keep default
            }
        }
        return new PortkeyConfig(stripTrailingSlash(baseUrl), apiKey, provider, model, timeoutMs);
    }

    boolean isEnabled() {
        return notBlank(apiKey) && notBlank(provider) && notBlank(model);
    }

    private static String resolveProfileValue(Environment environment, String propKey, String envKey, String profile) {
        if (notBlank(profile)) {
            String suffix = profile.toUpperCase(Locale.ROOT);
            String profiled = getTrimmed(environment, propKey + "." + suffix, envKey + "_" + suffix);
            if (notBlank(profiled)) {
                return profiled;
            }
        }
        return getTrimmed(environment, propKey, envKey);
    }

    private static String getTrimmed(Environment environment, String propKey, String envKey) {
        if (environment == null) {
            return null;
        }
        String v = environment.getProperty(propKey);
        if (v == null || v.isBlank()) {
            v = environment.getProperty(envKey);
        }
        return v != null ? v.trim() : null;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }
}
