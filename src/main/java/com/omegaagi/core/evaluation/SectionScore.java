package com.omegaagi.core.evaluation;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Structured verdict returned by the backend when scoring a section.
 */
public record SectionScore(
    @JsonPropertyDescription("Quality score from 0 (useless) to 100 (perfect)") int score,
    @JsonPropertyDescription("One sentence explaining the score") String justification
) {}
