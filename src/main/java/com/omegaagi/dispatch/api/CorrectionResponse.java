package com.omegaagi.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outbound JSON for POST /api/v1/omega/correct.
 */
public record CorrectionResponse(
    @JsonProperty("corrected_script") String correctedScript,
    int attempts
) {}
