package com.omegaagi.dispatch.api;

import java.util.List;

/**
 * Outbound JSON for POST /api/v1/omega/execute.
 */
public record ExecutionResponse(
    String result,
    List<String> warnings
) {}
