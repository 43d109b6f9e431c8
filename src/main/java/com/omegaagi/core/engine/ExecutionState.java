package com.omegaagi.core.engine;

import com.omegaagi.core.model.ParsedScript;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The mutable result accumulator of one execution: generated section content and
 * per-section warnings, keyed by section symbol.
 * <p>
 * Each section writes only its own entries, from its own worker task; dependents read
 * them only after that task has completed.
 */
public class ExecutionState {

    private final String executionId;
    private final ParsedScript script;
    private final String modelId;
    private final Map<String, String> contents = new ConcurrentHashMap<>();
    private final Map<String, List<String>> warnings = new ConcurrentHashMap<>();

    public ExecutionState(String executionId, ParsedScript script, String modelId) {
        this.executionId = executionId;
        this.script = script;
        this.modelId = modelId;
    }

    public String executionId() {
        return executionId;
    }

    public ParsedScript script() {
        return script;
    }

    public String modelId() {
        return modelId;
    }

    public void putContent(String symbol, String content) {
        contents.put(symbol, content == null ? "" : content);
    }

    public Optional<String> content(String symbol) {
        return Optional.ofNullable(contents.get(symbol));
    }

    public void addWarning(String symbol, String warning) {
        warnings.computeIfAbsent(symbol, k -> new CopyOnWriteArrayList<>()).add(warning);
    }

    public List<String> warningsFor(String symbol) {
        return new ArrayList<>(warnings.getOrDefault(symbol, List.of()));
    }
}
