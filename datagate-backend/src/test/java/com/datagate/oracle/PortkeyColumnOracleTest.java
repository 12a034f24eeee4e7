package com.datagate.oracle;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;

class PortkeyColumnOracleTest {

    @Test
    void disabledWithoutKeys() {
        PortkeyColumnOracle oracle = new PortkeyColumnOracle(new ObjectMapper(), new MockEnvironment());

        OracleUnavailableException e = assertThrows(OracleUnavailableException.class, () -> oracle.request("prompt", "system"));
        assertTrue(e.getMessage().contains("not configured"));
    }

    @Test
    void readsPropertiesWithEnvironmentFallback() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("datagate.oracle.portkey.api-key", " key ")
                .withProperty("PORTKEY_VIRTUAL_KEY", "vk")
                .withProperty("datagate.oracle.portkey.model", "gpt-4o-mini")
                .withProperty("datagate.oracle.portkey.base-url", "http://localhost:8787/")
                .withProperty("datagate.oracle.portkey.timeout-ms", "oops");

        PortkeyConfig config = PortkeyConfig.fromEnvironment(env);

        assertTrue(config.isEnabled());
        assertEquals("key", config.apiKey());
        assertEquals("vk", config.provider());
        assertEquals("http://localhost:8787", config.baseUrl());
        assertEquals(PortkeyConfig.DEFAULT_TIMEOUT_MS, config.timeoutMs());
    }

    @Test
    void profileSelectsSuffixedValues() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("PORTKEY_PROFILE", "fast")
                .withProperty("PORTKEY_API_KEY", "key")
                .withProperty("PORTKEY_VIRTUAL_KEY", "vk")
                .withProperty("PORTKEY_MODEL", "big-model")
                .withProperty("PORTKEY_MODEL_FAST", "small-model");

        PortkeyConfig config = PortkeyConfig.fromEnvironment(env);

        assertEquals("small-model", config.model());
        assertEquals(PortkeyConfig.DEFAULT_BASE_URL, config.baseUrl());
    }
}
