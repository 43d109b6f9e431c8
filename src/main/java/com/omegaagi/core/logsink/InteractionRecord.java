package com.omegaagi.core.logsink;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One stored backend interaction, as laid out in the {@code query_logs} table.
 */
public record InteractionRecord(
    String id,
    String prompt,
    String response,
    String model,
    @JsonProperty("created_at") Instant createdAt
) {}
