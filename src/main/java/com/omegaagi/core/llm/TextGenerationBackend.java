package com.omegaagi.core.llm;

/**
 * The external generative text service.
 * <p>
 * Implementations must be safe to call from several threads at once. Failures are
 * reported as {@link BackendException} so callers can tell transient faults from
 * policy refusals.
 */
public interface TextGenerationBackend {

    /**
     * @param prompt      full prompt text
     * @param modelId     model to use
     * @param temperature sampling temperature
     * @param timeoutMs   time budget for this call
     * @return generated text, treated as opaque
     * @throws BackendException when the call fails
     */
    String generate(String prompt, String modelId, double temperature, long timeoutMs);
}
