package com.omegaagi.core.reflection;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.omegaagi.core.model.ReflectionReport;

import java.util.List;

/**
 * Structured critique of a script, as returned by the backend.
 */
public record ScriptCritique(
    @JsonPropertyDescription("Structural quality score from 1 to 100") int score,
    @JsonPropertyDescription("Short overall assessment of the script") String summary,
    @JsonPropertyDescription("Concrete improvement suggestions, one per entry") List<String> recommendations
) {

    ReflectionReport toReport() {
        List<String> items = recommendations == null ? List.of()
                : recommendations.stream().filter(r -> r != null && !r.isBlank()).map(String::trim).toList();
        int bounded = Math.max(1, Math.min(100, score));
        var feedback = new StringBuilder("Score: ").append(bounded);
        if (summary != null && !summary.isBlank()) {
            feedback.append('\n').append(summary.trim());
        }
        items.forEach(item -> feedback.append("\n- ").append(item));
        return new ReflectionReport(bounded, items, feedback.toString());
    }
}
