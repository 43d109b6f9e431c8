package com.omegaagi.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during script execution.
 *
 * @param eventType   e.g. "execution.started", "section.generated", "section.refined"
 * @param executionId the execution this event belongs to
 * @param section     the section symbol this event relates to (null for execution-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record OmegaEvent(
    String eventType,
    String executionId,
    String section,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String EXECUTION_STARTED = "execution.started";
    public static final String SECTION_GENERATED = "section.generated";
    public static final String SECTION_REFINED = "section.refined";
    public static final String EXECUTION_COMPLETED = "execution.completed";
    public static final String EXECUTION_FAILED = "execution.failed";

    public static OmegaEvent of(String eventType, String executionId, String section, Map<String, Object> payload) {
        return new OmegaEvent(eventType, executionId, section, payload, Instant.now());
    }
}
