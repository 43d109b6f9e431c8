package com.omegaagi.core.model;

/**
 * Outcome of a successful repair.
 *
 * @param correctedScript a script that passes validation
 * @param attempts        backend repair rounds used; 0 when the input was already valid
 */
public record CorrectionResult(
    String correctedScript,
    int attempts
) {}
