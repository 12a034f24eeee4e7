package com.datagate.oracle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ColumnOracle} backed by an OpenAI-compatible chat completions endpoint behind the Portkey gateway.
 *
 * <p>Plain HTTP through {@link HttpClient}; no vendor SDK. Configuration is re-read on each call, so the
 * oracle can be enabled without a restart when properties come from a refreshable source.
 */
public class PortkeyColumnOracle implements ColumnOracle {

    private static final Logger log = LoggerFactory.getLogger(PortkeyColumnOracle.class);

    private final ObjectMapper objectMapper;
    private final Environment environment;
    private final HttpClient httpClient;

    public PortkeyColumnOracle(ObjectMapper objectMapper, Environment environment) {
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Log whether the oracle is usable. Secrets are never logged.
     */
    public void logConfigStatus() {
        PortkeyConfig config = PortkeyConfig.fromEnvironment(environment);
        if (config.isEnabled()) {
            log.info("Column oracle is ENABLED (gateway_base_url={}, model={})", config.baseUrl(), config.model());
        } else {
            log.warn("Column oracle is DISABLED, healing falls back to the first semantic alternative "
                            + "(gateway_base_url={}, api_key_configured={}, virtual_key_configured={}, model_configured={})",
                    config.baseUrl(),
                    config.apiKey() != null && !config.apiKey().isBlank(),
                    config.provider() != null && !config.provider().isBlank(),
                    config.model() != null && !config.model().isBlank());
        }
    }

    @Override
    public String request(String prompt, String systemPrompt) throws OracleUnavailableException {
        PortkeyConfig config = PortkeyConfig.fromEnvironment(environment);
        if (!config.isEnabled()) {
            throw new OracleUnavailableException("Column oracle is not configured (PORTKEY_API_KEY, PORTKEY_VIRTUAL_KEY, PORTKEY_MODEL)");
        }

        List<Map<String, Object>> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Map.of("role", "system", "content", systemPrompt));
        }
        messages.add(Map.of("role", "user", "content", prompt != null ? prompt : ""));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", config.model());
        payload.put("messages", messages);
        payload.put("temperature", 0);

        try {
            String json = objectMapper.writeValueAsString(payload);
            HttpRequest httpRequest = HttpRequest.newBuilder()
                    .uri(URI.create(config.baseUrl() + "/v1/chat/completions"))
                    .timeout(Duration.ofMillis(config.timeoutMs()))
                    .header("Content-Type", "application/json")
                    .header("x-portkey-api-key", config.apiKey())
                    .header("x-portkey-virtual-key", config.provider())
                    .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();

            HttpResponse<String> response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                log.warn("Oracle gateway request failed (status_code={}, gateway_base_url={}, model={})",
                        response.statusCode(), config.baseUrl(), config.model());
                throw new OracleUnavailableException("Oracle gateway error: HTTP " + response.statusCode());
            }

            JsonNode root = objectMapper.readTree(response.body());
            JsonNode contentNode = root.path("choices").path(0).path("message").path("content");
            return contentNode.isTextual() ? contentNode.asText() : "";
        } catch (IOException e) {
            throw new OracleUnavailableException("Oracle request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("Oracle request interrupted", e);
        }
    }
}
