package com.omegaagi.core.llm;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.engine.ExecutionScope;
import com.omegaagi.core.error.BackendRefusalException;
import com.omegaagi.core.error.BackendUnavailableException;
import com.omegaagi.core.error.ExecutionCancelledException;
import com.omegaagi.core.logsink.LogSink;
import com.omegaagi.core.metrics.OmegaMetrics;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Single entry point for backend calls, wrapping a {@link TextGenerationBackend}.
 * <p>
 * Every call is bounded by {@code omega.backend-timeout-ms}; a call that overruns is
 * cancelled. Transient failures (timeouts, network faults, rate limits) are retried
 * once with identical input and then surface as {@link BackendUnavailableException}.
 * Refusals surface as {@link BackendRefusalException} straight away. Successful calls
 * are handed to the {@link LogSink}.
 * <p>
 * {@link #structuredCall} asks for JSON matching a record and converts the reply with
 * Spring AI's {@link BeanOutputConverter}, falling back to a lenient Jackson read.
 * <p>
 * Exception messages never include prompt text or raw backend error bodies.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    static final int MAX_ATTEMPTS = 2;

    private static final ObjectMapper LENIENT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
            .registerModule(new ParameterNamesModule());

    private final TextGenerationBackend backend;
    private final LogSink logSink;
    private final OmegaMetrics metrics;
    private final OmegaProperties properties;

    public LlmService(TextGenerationBackend backend, LogSink logSink, OmegaMetrics metrics,
                      OmegaProperties properties) {
        this.backend = backend;
        this.logSink = logSink;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Calls the backend outside of any script execution, on a short-lived scope.
     */
    public String call(CallPurpose purpose, String subject, String prompt, String modelId, double temperature) {
        try (var scope = new ExecutionScope("omega-" + purpose.tag(), 1)) {
            return call(scope, purpose, subject, prompt, modelId, temperature);
        }
    }

    /**
     * Calls the backend on behalf of one execution.
     *
     * @param scope       the execution's threads; cancelling it abandons this call
     * @param purpose     what the call is for
     * @param subject     short, prompt-free description used in logs and errors, e.g. "section Q"
     * @param prompt      full prompt text
     * @param modelId     model to use
     * @param temperature sampling temperature
     * @return the backend's text, never null
     */
    public String call(ExecutionScope scope, CallPurpose purpose, String subject, String prompt,
                       String modelId, double temperature) {
        long timeoutMs = properties.getBackendTimeoutMs();
        for (int attempt = 1; ; attempt++) {
            scope.checkNotCancelled();
            long start = System.currentTimeMillis();
            try {
                String response = invoke(scope, prompt, modelId, temperature, timeoutMs);
                long elapsed = System.currentTimeMillis() - start;
                metrics.recordBackendCall(purpose.tag(), "success", elapsed);
                log.debug("Backend call to {} {} completed in {}ms ({} chars)",
                        purpose.verb(), subject, elapsed, response.length());
                recordInteraction(prompt, response, modelId);
                return response;
            } catch (BackendException e) {
                long elapsed = System.currentTimeMillis() - start;
                if (e.isRefusal()) {
                    metrics.recordBackendCall(purpose.tag(), "refused", elapsed);
                    log.warn("Backend refused to {} {}: {}", purpose.verb(), subject, e.getMessage());
                    throw new BackendRefusalException("Backend refused to " + purpose.verb() + " " + subject, e);
                }
                if (e.isTransient() && attempt < MAX_ATTEMPTS) {
                    metrics.recordBackendCall(purpose.tag(), "retry", elapsed);
                    log.warn("Transient backend failure ({}) trying to {} {}; retrying once",
                            e.reason(), purpose.verb(), subject);
                    continue;
                }
                metrics.recordBackendCall(purpose.tag(), "failed", elapsed);
                log.error("Backend unavailable trying to {} {} after {} attempt(s): {}",
                        purpose.verb(), subject, attempt, e.getMessage());
                throw new BackendUnavailableException("Backend unavailable trying to " + purpose.verb() + " "
                        + subject + " (" + e.reason().name().toLowerCase(Locale.ROOT) + ")", e);
            }
        }
    }

    /**
     * Like {@link #structuredCall(ExecutionScope, CallPurpose, String, String, String, double, Class)},
     * outside of any script execution.
     */
    public <T> T structuredCall(CallPurpose purpose, String subject, String prompt, String modelId,
                                double temperature, Class<T> outputType) {
        try (var scope = new ExecutionScope("omega-" + purpose.tag(), 1)) {
            return structuredCall(scope, purpose, subject, prompt, modelId, temperature, outputType);
        }
    }

    /**
     * Sends the prompt with JSON format instructions for {@code outputType} appended and
     * returns the reply deserialized into that type. Timeout, retry and logging are those
     * of {@link #call(ExecutionScope, CallPurpose, String, String, String, double)}.
     *
     * @throws LlmParseException if the reply cannot be read as {@code outputType}; it
     *                           carries the raw reply so the caller can fall back
     */
    public <T> T structuredCall(ExecutionScope scope, CallPurpose purpose, String subject, String prompt,
                                String modelId, double temperature, Class<T> outputType) {
        var converter = new BeanOutputConverter<>(outputType);
        String response = call(scope, purpose, subject, prompt + "\n\n" + converter.getFormat(),
                modelId, temperature);
        if (response.isBlank()) {
            throw new LlmParseException("Empty reply for " + outputType.getSimpleName(), response, null);
        }
        try {
            T converted = converter.convert(response);
            if (converted != null) {
                return converted;
            }
        } catch (RuntimeException e) {
            log.debug("Structured conversion to {} failed: {}", outputType.getSimpleName(), e.getMessage());
        }
        return parseWithJackson(response, outputType);
    }

    /**
     * Reads the first JSON object in the reply, ignoring code fences and surrounding prose.
     */
    private <T> T parseWithJackson(String response, Class<T> outputType) {
        String cleaned = ResponseText.stripCodeFence(response);
        int open = cleaned.indexOf('{');
        int close = cleaned.lastIndexOf('}');
        if (open >= 0 && close > open) {
            cleaned = cleaned.substring(open, close + 1);
        }
        try {
            T parsed = LENIENT_MAPPER.readValue(cleaned, outputType);
            if (parsed == null) {
                throw new LlmParseException("Reply held no " + outputType.getSimpleName(), response, null);
            }
            log.debug("Jackson fallback read {} from a {} char reply", outputType.getSimpleName(), response.length());
            return parsed;
        } catch (JsonProcessingException e) {
            log.warn("Reply could not be read as {}: {}", outputType.getSimpleName(), e.getOriginalMessage());
            throw new LlmParseException("Reply could not be read as " + outputType.getSimpleName(), response, e);
        }
    }

    private String invoke(ExecutionScope scope, String prompt, String modelId, double temperature, long timeoutMs) {
        Future<String> future = scope.submitCall(() -> backend.generate(prompt, modelId, temperature, timeoutMs));
        try {
            String text = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            return text == null ? "" : text;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BackendException("No response within " + timeoutMs + "ms", BackendException.Reason.TIMEOUT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof BackendException backendFailure) {
                throw backendFailure;
            }
            if (scope.isCancelled()) {
                throw new ExecutionCancelledException(scope.executionId());
            }
            throw new BackendException("Backend call failed with " + cause.getClass().getSimpleName(),
                    BackendException.Reason.FAILED, cause);
        } catch (CancellationException e) {
            throw new ExecutionCancelledException(scope.executionId());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(scope.executionId());
        }
    }

    private void recordInteraction(String prompt, String response, String modelId) {
        try {
            logSink.record(prompt, response, modelId, Instant.now());
        } catch (RuntimeException e) {
            metrics.recordLogSinkFailure();
            log.warn("Log sink failed to record interaction: {}", e.getMessage());
        }
    }
}
