package com.omegaagi.support;

import com.omegaagi.core.assembly.OutputAssembler;
import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.correction.ScriptCorrector;
import com.omegaagi.core.engine.OmegaInterpreter;
import com.omegaagi.core.evaluation.LlmSectionScorer;
import com.omegaagi.core.evaluation.RefinementLoop;
import com.omegaagi.core.events.EventBus;
import com.omegaagi.core.generation.GenerationCoordinator;
import com.omegaagi.core.generation.PromptComposer;
import com.omegaagi.core.graph.DependencyGraphResolver;
import com.omegaagi.core.llm.LlmService;
import com.omegaagi.core.llm.TextGenerationBackend;
import com.omegaagi.core.metrics.OmegaMetrics;
import com.omegaagi.core.scanner.DirectiveParser;
import com.omegaagi.core.scanner.ScriptParser;
import com.omegaagi.core.scanner.ScriptScanner;
import com.omegaagi.core.scanner.SymbolTableBuilder;
import com.omegaagi.core.validation.ScriptValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

/**
 * Wires the real interpreter components by hand, without a Spring context.
 */
public final class TestInterpreters {

    /** Prompt prefixes that tell the kinds of backend call apart. */
    public static final String GENERATION_PROMPT = "You are writing";
    public static final String FEEDBACK_PROMPT = "You are reviewing";
    public static final String REGENERATION_PROMPT = "You are revising";
    public static final String SCORING_PROMPT = "Rate how well";

    private TestInterpreters() {}

    public static OmegaProperties properties() {
        var properties = new OmegaProperties();
        properties.setBackendTimeoutMs(5_000);
        return properties;
    }

    public static OmegaMetrics metrics() {
        return new OmegaMetrics(new SimpleMeterRegistry());
    }

    public static ScriptValidator validator(OmegaProperties properties) {
        return new ScriptValidator(
                new ScriptScanner(),
                new ScriptParser(new SymbolTableBuilder(), new DirectiveParser(), properties),
                new DependencyGraphResolver());
    }

    public static LlmService llmService(TextGenerationBackend backend, OmegaProperties properties) {
        return new LlmService(backend, (prompt, response, model, timestamp) -> { }, metrics(), properties);
    }

    public static RefinementLoop refinementLoop(LlmService llm, OmegaProperties properties) {
        return new RefinementLoop(llm, new LlmSectionScorer(llm, properties), new PromptComposer(), properties,
                metrics());
    }

    public static OmegaInterpreter interpreter(TextGenerationBackend backend, OmegaProperties properties) {
        return interpreter(backend, properties, new EventBus());
    }

    public static OmegaInterpreter interpreter(TextGenerationBackend backend, OmegaProperties properties,
                                               EventBus eventBus) {
        var llm = llmService(backend, properties);
        var validator = validator(properties);
        var coordinator = new GenerationCoordinator(llm, new PromptComposer(), refinementLoop(llm, properties),
                eventBus, metrics(), properties);
        return new OmegaInterpreter(validator, new ScriptCorrector(llm, validator, properties, metrics()),
                coordinator, new OutputAssembler(), eventBus, metrics(), properties);
    }
}
