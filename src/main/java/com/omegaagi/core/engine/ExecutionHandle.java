package com.omegaagi.core.engine;

import com.omegaagi.core.error.ExecutionCancelledException;
import com.omegaagi.core.model.ExecutionResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CancellationException;

/**
 * A running execution started with {@link OmegaInterpreter#start}.
 */
public class ExecutionHandle {

    private final String executionId;
    private final CompletableFuture<ExecutionResult> result;
    private final ExecutionScope scope;

    ExecutionHandle(String executionId, CompletableFuture<ExecutionResult> result, ExecutionScope scope) {
        this.executionId = executionId;
        this.result = result;
        this.scope = scope;
    }

    public String executionId() {
        return executionId;
    }

    public CompletableFuture<ExecutionResult> result() {
        return result;
    }

    /**
     * Blocks until the execution finishes.
     *
     * @throws com.omegaagi.core.error.OmegaException the execution's failure, unwrapped
     */
    public ExecutionResult await() {
        try {
            return result.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } catch (CancellationException e) {
            throw new ExecutionCancelledException(executionId);
        }
    }

    /**
     * Cancels every in-flight backend call of this execution. The result then completes
     * with an {@link ExecutionCancelledException}.
     */
    public void cancel() {
        scope.cancel();
    }

    public boolean isDone() {
        return result.isDone();
    }
}
