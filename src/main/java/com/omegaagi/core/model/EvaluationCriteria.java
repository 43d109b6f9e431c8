package com.omegaagi.core.model;

/**
 * Quality bar attached to a section by {@code EVAL_SECT}.
 *
 * @param threshold     minimum acceptable score, 0..100 inclusive
 * @param maxIterations maximum number of regeneration rounds, at least 1
 */
public record EvaluationCriteria(
    int threshold,
    int maxIterations
) {

    public EvaluationCriteria {
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("threshold must be within 0..100, was " + threshold);
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, was " + maxIterations);
        }
    }

    public boolean isMetBy(int score) {
        return score >= threshold;
    }
}
