package com.omegaagi.core.logsink;

import java.time.Instant;
import java.util.List;

/**
 * Destination for prompt/response records of every backend call.
 * <p>
 * Recording is best effort and must not block the caller for long; implementations
 * may drop a record rather than fail the execution that produced it.
 */
public interface LogSink {

    void record(String prompt, String response, String modelId, Instant timestamp);

    /**
     * Most recent records first. Sinks that do not retain records return an empty list.
     */
    default List<InteractionRecord> recent(int limit) {
        return List.of();
    }
}
