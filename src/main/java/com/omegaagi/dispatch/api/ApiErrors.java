package com.omegaagi.dispatch.api;

import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.error.ScriptValidationException;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps interpreter failures to HTTP responses of the form {@code {error, message}}.
 * <p>
 * Script faults are 422, refusals 502 and an unavailable backend 503. Only the error
 * kind and the exception's sanitized message are exposed.
 */
final class ApiErrors {

    private ApiErrors() {}

    static ResponseEntity<Map<String, Object>> from(OmegaException e) {
        int status = switch (e.kind()) {
            case STRUCTURAL, UNDEFINED_SYMBOL, CYCLIC_DEPENDENCY, CORRECTION_EXHAUSTED -> 422;
            case BACKEND_REFUSAL -> 502;
            case BACKEND_UNAVAILABLE -> 503;
            case QUALITY_THRESHOLD_UNMET -> 500;
        };
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.kind().displayName());
        body.put("message", e.getMessage());
        if (e instanceof ScriptValidationException invalid) {
            body.put("errors", invalid.errors().stream()
                    .map(error -> Map.of("kind", error.kind().displayName(), "message", error.message()))
                    .toList());
        }
        return ResponseEntity.status(status).body(body);
    }

    static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", "BadRequest", "message", message));
    }

    static boolean isBlank(String text) {
        return text == null || text.isBlank();
    }
}
