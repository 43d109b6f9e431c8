package com.omegaagi.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/human-to-omega.
 */
public record HumanToOmegaRequest(
    @JsonProperty("human_text") String humanText,
    String model
) {}
