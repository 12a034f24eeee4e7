package com.datagate.oracle;

/**
 * External advisor (normally an LLM) asked to pick the correct column during query healing.
 */
public interface ColumnOracle {

    /**
     * Send a prompt and return the raw textual reply.
     *
     * @param prompt user prompt
     * @param systemPrompt system prompt, may be null
     * @return reply text
     * @throws OracleUnavailableException when the oracle is not configured or the call fails
     */
    String request(String prompt, String systemPrompt) throws OracleUnavailableException;
}
