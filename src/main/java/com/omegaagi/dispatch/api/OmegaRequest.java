package com.omegaagi.dispatch.api;

/**
 * Inbound JSON body for the script endpoints under /api/v1/omega.
 *
 * @param omega the script text
 * @param model model to use; nullable, defaults to {@code omega.default-model}
 */
public record OmegaRequest(
    String omega,
    String model
) {}
