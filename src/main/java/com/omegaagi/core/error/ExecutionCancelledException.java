package com.omegaagi.core.error;

/**
 * The execution was cancelled by its caller while backend calls were pending.
 */
public class ExecutionCancelledException extends BackendUnavailableException {

    public ExecutionCancelledException(String executionId) {
        super("Execution " + executionId + " was cancelled");
    }
}
