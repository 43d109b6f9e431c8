package com.omegaagi.core.generation;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.engine.ExecutionScope;
import com.omegaagi.core.engine.ExecutionState;
import com.omegaagi.core.error.ExecutionCancelledException;
import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.evaluation.RefinementLoop;
import com.omegaagi.core.events.EventBus;
import com.omegaagi.core.events.OmegaEvent;
import com.omegaagi.core.llm.CallPurpose;
import com.omegaagi.core.llm.LlmService;
import com.omegaagi.core.logging.MdcContext;
import com.omegaagi.core.metrics.OmegaMetrics;
import com.omegaagi.core.model.ParsedScript;
import com.omegaagi.core.model.SectionDirective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Generates every section of a validated script.
 * <p>
 * Each section becomes one task on the execution's worker pool that starts once all of
 * its upstream sections have finished, so independent sections run concurrently within
 * the pool bound. A section with evaluation criteria is refined inside the same task,
 * so dependents always see the final content. The first failure cancels the rest of
 * the execution and is rethrown.
 */
@Component
public class GenerationCoordinator {

    private static final Logger log = LoggerFactory.getLogger(GenerationCoordinator.class);

    private final LlmService llmService;
    private final PromptComposer composer;
    private final RefinementLoop refinementLoop;
    private final EventBus eventBus;
    private final OmegaMetrics metrics;
    private final OmegaProperties properties;

    public GenerationCoordinator(LlmService llmService, PromptComposer composer, RefinementLoop refinementLoop,
                                 EventBus eventBus, OmegaMetrics metrics, OmegaProperties properties) {
        this.llmService = llmService;
        this.composer = composer;
        this.refinementLoop = refinementLoop;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Generates all sections into {@code state}.
     *
     * @param order section tokens, every dependency before its dependents
     * @throws OmegaException the first failure of any section
     */
    public void generateAll(ExecutionScope scope, ExecutionState state, List<String> order) {
        var script = state.script();
        var firstFailure = new AtomicReference<Throwable>();
        Map<String, CompletableFuture<Void>> tasks = new LinkedHashMap<>();

        for (String token : order) {
            SectionDirective section = script.section(token)
                    .orElseThrow(() -> new IllegalStateException("No section directive for " + token));
            List<String> upstream = upstreamSections(script, token);
            CompletableFuture<?>[] prerequisites = upstream.stream()
                    .map(tasks::get)
                    .toArray(CompletableFuture[]::new);

            CompletableFuture<Void> task = CompletableFuture.allOf(prerequisites)
                    .thenRunAsync(() -> produce(scope, state, section, upstream), scope.workers())
                    .whenComplete((ignored, failure) -> {
                        if (failure != null && firstFailure.compareAndSet(null, unwrap(failure))) {
                            scope.cancel();
                        }
                    });
            tasks.put(token, task);
        }

        try {
            CompletableFuture.allOf(tasks.values().toArray(CompletableFuture[]::new)).get();
        } catch (ExecutionException e) {
            firstFailure.compareAndSet(null, unwrap(e.getCause()));
        } catch (InterruptedException e) {
            scope.cancel();
            Thread.currentThread().interrupt();
            throw new ExecutionCancelledException(state.executionId());
        }

        Throwable failure = firstFailure.get();
        if (failure instanceof RuntimeException runtime) {
            throw runtime;
        }
        if (failure != null) {
            throw new IllegalStateException("Section generation failed", failure);
        }
    }

    private void produce(ExecutionScope scope, ExecutionState state, SectionDirective section,
                         List<String> upstream) {
        scope.checkNotCancelled();
        String token = section.symbol();
        MdcContext.setSection(state.executionId(), token);
        long start = System.currentTimeMillis();
        try {
            Map<String, String> dependencyContent = new LinkedHashMap<>();
            for (String dependency : upstream) {
                dependencyContent.put(dependency, state.content(dependency).orElse(""));
            }

            String prompt = composer.composeGeneration(state.script(), section, dependencyContent);
            String content = llmService.call(scope, CallPurpose.GENERATE, "section " + token, prompt,
                    state.modelId(), properties.getGenerationTemperature());
            eventBus.publish(OmegaEvent.of(OmegaEvent.SECTION_GENERATED, state.executionId(), token,
                    Map.of("chars", content.length())));

            if (section.evaluationCriteria().isPresent()) {
                var outcome = refinementLoop.refine(scope, state, section, dependencyContent, content);
                content = outcome.content();
                outcome.warning().ifPresent(warning -> state.addWarning(token, warning));
                eventBus.publish(OmegaEvent.of(OmegaEvent.SECTION_REFINED, state.executionId(), token,
                        Map.of("score", outcome.score(),
                                "regenerations", outcome.regenerations(),
                                "thresholdMet", outcome.thresholdMet())));
            }

            state.putContent(token, content);
            long elapsed = System.currentTimeMillis() - start;
            metrics.recordSectionDuration(elapsed);
            log.info("Section {} generated in {}ms ({} chars)", token, elapsed, content.length());
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Sections {@code token} needs content from: its direct dependencies, looking through
     * graph-only symbols to the sections behind them.
     */
    static List<String> upstreamSections(ParsedScript script, String token) {
        var result = new LinkedHashSet<String>();
        var visited = new HashSet<String>();
        var pending = new ArrayDeque<>(script.dependenciesOf(token));
        while (!pending.isEmpty()) {
            String dependency = pending.poll();
            if (!visited.add(dependency)) {
                continue;
            }
            if (script.section(dependency).isPresent()) {
                result.add(dependency);
            } else {
                pending.addAll(script.dependenciesOf(dependency));
            }
        }
        return new ArrayList<>(result);
    }

    private static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
