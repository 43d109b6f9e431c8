package com.omegaagi.core.model;

import java.util.List;

/**
 * The only externally observable success output of an execution.
 *
 * @param text     assembled section contents in declaration order
 * @param warnings non-fatal findings such as unmet quality thresholds
 */
public record ExecutionResult(
    String text,
    List<String> warnings
) {

    public ExecutionResult {
        warnings = List.copyOf(warnings);
    }
}
