package com.omegaagi.core.model;

import java.util.List;

/**
 * Backend critique of a script's structure.
 *
 * @param score           structural quality score, 1..100
 * @param recommendations improvement suggestions, one per entry
 * @param rawFeedback     the full critique text
 */
public record ReflectionReport(
    int score,
    List<String> recommendations,
    String rawFeedback
) {

    public ReflectionReport {
        recommendations = List.copyOf(recommendations);
    }
}
