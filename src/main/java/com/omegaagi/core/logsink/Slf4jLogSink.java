package com.omegaagi.core.logsink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * Fallback sink that writes interactions to the application log at DEBUG level.
 */
public class Slf4jLogSink implements LogSink {

    private static final Logger log = LoggerFactory.getLogger(Slf4jLogSink.class);

    @Override
    public void record(String prompt, String response, String modelId, Instant timestamp) {
        if (log.isDebugEnabled()) {
            log.debug("Backend interaction at {} with model {}: prompt {} chars, response {} chars",
                    timestamp, modelId, length(prompt), length(response));
        }
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
