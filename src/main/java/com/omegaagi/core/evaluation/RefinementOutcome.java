package com.omegaagi.core.evaluation;

import java.util.Optional;

/**
 * Result of refining one section.
 *
 * @param content       the best-scoring attempt
 * @param score         its score
 * @param regenerations regeneration rounds performed
 * @param warning       set when the threshold was never reached
 */
public record RefinementOutcome(
    String content,
    int score,
    int regenerations,
    Optional<String> warning
) {

    public boolean thresholdMet() {
        return warning.isEmpty();
    }
}
