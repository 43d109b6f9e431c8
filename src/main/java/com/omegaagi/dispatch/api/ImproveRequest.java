package com.omegaagi.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/omega/improve.
 *
 * @param omega    the script text
 * @param feedback critique to act on; nullable, a reflection is run when absent
 * @param score    the script's current score, if known
 * @param model    model to use; nullable
 */
public record ImproveRequest(
    String omega,
    String feedback,
    Integer score,
    String model
) {}
