package com.omegaagi.core.engine;

import com.omegaagi.core.error.ExecutionCancelledException;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads owned by a single execution.
 * <p>
 * Section work runs on a fixed pool of {@code maxParallel} workers, so no more than that
 * many sections are in flight at once. Backend calls run on a separate pool so a worker
 * can stop waiting on a call that has exceeded its timeout.
 * <p>
 * {@link #cancel()} cancels every in-flight backend call of this execution and makes
 * any section task that has not started yet fail on entry. Nothing is shared between
 * executions.
 */
public class ExecutionScope implements AutoCloseable {

    private final String executionId;
    private final ExecutorService workers;
    private final ExecutorService calls;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ExecutionScope(String executionId, int maxParallel) {
        if (maxParallel < 1) {
            throw new IllegalArgumentException("maxParallel must be at least 1, got " + maxParallel);
        }
        this.executionId = executionId;
        this.workers = Executors.newFixedThreadPool(maxParallel, namedDaemon(executionId + "-section-"));
        this.calls = Executors.newCachedThreadPool(namedDaemon(executionId + "-call-"));
    }

    public String executionId() {
        return executionId;
    }

    /** Executor for per-section tasks. */
    public Executor workers() {
        return workers;
    }

    /**
     * Submits one backend call.
     *
     * @throws ExecutionCancelledException if the scope has been cancelled
     */
    public <T> Future<T> submitCall(Callable<T> call) {
        var task = new FutureTask<T>(call) {
            @Override
            protected void done() {
                inFlight.remove(this);
            }
        };
        inFlight.add(task);
        if (cancelled.get()) {
            task.cancel(true);
            throw new ExecutionCancelledException(executionId);
        }
        try {
            calls.execute(task);
        } catch (RejectedExecutionException e) {
            task.cancel(true);
            throw new ExecutionCancelledException(executionId);
        }
        return task;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void checkNotCancelled() {
        if (cancelled.get()) {
            throw new ExecutionCancelledException(executionId);
        }
    }

    /**
     * Stops all outstanding work. Idempotent.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            inFlight.forEach(call -> call.cancel(true));
            calls.shutdownNow();
        }
    }

    int inFlightCalls() {
        return inFlight.size();
    }

    @Override
    public void close() {
        workers.shutdown();
        calls.shutdownNow();
    }

    private static ThreadFactory namedDaemon(String prefix) {
        var counter = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
