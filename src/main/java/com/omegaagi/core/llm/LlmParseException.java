package com.omegaagi.core.llm;

/**
 * A backend reply could not be converted into the requested type.
 * <p>
 * Keeps the raw reply so callers can fall back to reading it as free text. The message
 * never includes the reply.
 */
public class LlmParseException extends RuntimeException {

    private final String rawResponse;

    public LlmParseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse == null ? "" : rawResponse;
    }

    public String rawResponse() {
        return rawResponse;
    }
}
