package com.omegaagi.core.reflection;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.support.StubBackend;
import com.omegaagi.support.TestInterpreters;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptReflectorTest {

    private static final String CRITIQUE = """
            Score: 72
            The structure is sound but sparse.
            - Add an EVAL_SECT for the summary
            * Describe each symbol
            1. Split the body into two sections
            """;

    private OmegaProperties properties;

    @BeforeEach
    void setUp() {
        properties = TestInterpreters.properties();
    }

    private ScriptReflector reflector(StubBackend backend) {
        return new ScriptReflector(TestInterpreters.llmService(backend, properties), properties);
    }

    @Nested
    @DisplayName("parseReport")
    class ParseReport {

        @Test
        @DisplayName("reads the score and every bullet as a recommendation")
        void readsScoreAndBullets() {
            var report = ScriptReflector.parseReport(CRITIQUE);

            assertEquals(72, report.score());
            assertEquals(List.of("Add an EVAL_SECT for the summary", "Describe each symbol",
                    "Split the body into two sections"), report.recommendations());
            assertEquals(CRITIQUE.trim(), report.rawFeedback());
        }

        @Test
        @DisplayName("reads a markdown-formatted critique")
        void readsMarkdown() {
            var report = ScriptReflector.parseReport("""
                    **Score:** 85

                    The script uses 3 sections and 2 edges sensibly.
                    - **Add** an EVAL_SECT for the summary
                    """);

            assertEquals(85, report.score());
            assertEquals(List.of("**Add** an EVAL_SECT for the summary"), report.recommendations());
        }

        @Test
        @DisplayName("clamps the score into 1..100 and defaults to 1")
        void clampsScore() {
            assertEquals(100, ScriptReflector.parseReport("Score: 140").score());
            assertEquals(1, ScriptReflector.parseReport("Score: 0").score());
            assertEquals(1, ScriptReflector.parseReport("Looks fine").score());
            assertTrue(ScriptReflector.parseReport(null).recommendations().isEmpty());
        }
    }

    @Test
    @DisplayName("reflect reads a structured critique")
    void reflectStructured() {
        var backend = StubBackend.replying("""
                {"score": 64, "summary": "Sound but sparse.",
                 "recommendations": ["Describe each symbol", " ", "Add a memory graph"]}
                """);

        var report = reflector(backend).reflect("WR_SECT(S)", null);

        assertEquals(64, report.score());
        assertEquals(List.of("Describe each symbol", "Add a memory graph"), report.recommendations());
        assertEquals("Score: 64\nSound but sparse.\n- Describe each symbol\n- Add a memory graph",
                report.rawFeedback());
        String prompt = backend.prompts().get(0);
        assertTrue(prompt.contains("Script:\nWR_SECT(S)\n\n"));
        assertTrue(prompt.contains("recommendations"), "format instructions should describe the critique");
    }

    @Test
    @DisplayName("reflect falls back to reading a free-text critique")
    void reflectFreeText() {
        var backend = StubBackend.replying("**Score:** 85\n- Split the body into two sections");

        var report = reflector(backend).reflect("WR_SECT(S)", null);

        assertEquals(85, report.score());
        assertEquals(List.of("Split the body into two sections"), report.recommendations());
        assertEquals(1, backend.calls());
    }

    @Test
    @DisplayName("reflect clamps a structured score into 1..100")
    void reflectClampsStructuredScore() {
        var report = reflector(StubBackend.replying("{\"score\": 0, \"recommendations\": []}"))
                .reflect("WR_SECT(S)", null);

        assertEquals(1, report.score());
        assertTrue(report.recommendations().isEmpty());
    }

    @Test
    @DisplayName("improve uses the given feedback directly")
    void improveWithFeedback() {
        var backend = StubBackend.replying("```omega\nWR_SECT(S, d=\"better\")\n```");

        String improved = reflector(backend).improve("WR_SECT(S)", "Add a description", 40, null);

        assertEquals("WR_SECT(S, d=\"better\")", improved);
        assertEquals(1, backend.calls());
        String prompt = backend.prompts().get(0);
        assertTrue(prompt.contains("Feedback:\nAdd a description"));
        assertTrue(prompt.contains("Current quality score: 40/100"));
    }

    @Test
    @DisplayName("improve without feedback reflects first and uses the critique")
    void improveWithoutFeedback() {
        var backend = StubBackend.responding(prompt ->
                prompt.contains("Evaluate the following Omega script") ? CRITIQUE : "WR_SECT(S)");

        reflector(backend).improve("WR_SECT(S)", null, null, null);

        assertEquals(2, backend.calls());
        String improvePrompt = backend.prompts().get(1);
        assertTrue(improvePrompt.contains("Feedback:\n" + CRITIQUE.trim()));
        assertTrue(improvePrompt.contains("Current quality score: 72/100"));
    }
}
