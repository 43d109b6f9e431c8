package com.omegaagi.core.validation;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.error.ErrorKind;
import com.omegaagi.core.graph.DependencyGraphResolver;
import com.omegaagi.core.model.ValidationError;
import com.omegaagi.core.scanner.DirectiveParser;
import com.omegaagi.core.scanner.ScriptParser;
import com.omegaagi.core.scanner.ScriptScanner;
import com.omegaagi.core.scanner.SymbolTableBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptValidatorTest {

    private final ScriptValidator validator = new ScriptValidator(
            new ScriptScanner(),
            new ScriptParser(new SymbolTableBuilder(), new DirectiveParser(), new OmegaProperties()),
            new DependencyGraphResolver());

    private static List<ErrorKind> kinds(List<ValidationError> errors) {
        return errors.stream().map(ValidationError::kind).toList();
    }

    @Nested
    @DisplayName("Valid scripts")
    class ValidScripts {

        @Test
        @DisplayName("a well-formed script yields the parsed script and its generation order")
        void wellFormed() {
            var report = validator.validate("""
                    ROLE(technical writer)
                    DEFINE_SYMBOLS{
                      I="Introduction": opening paragraph,
                      B="Body"
                    }
                    MEM_GRAPH{ B -> [I] }
                    WR_SECT(B, d="Explain the details")
                    WR_SECT(I, t="Intro", d="Introduce the topic")
                    EVAL_SECT(B, th=85, iter=2)
                    """);

            assertTrue(report.valid());
            assertTrue(report.parsed().isPresent());
            assertEquals(List.of("I", "B"), report.generationOrder());
        }

        @Test
        @DisplayName("a single section without a graph is valid")
        void minimal() {
            var report = validator.validate("DEFINE_SYMBOLS{A=\"Answer\"}\nWR_SECT(A, d=\"Reply with 42\")");
            assertTrue(report.valid());
            assertEquals(List.of("A"), report.generationOrder());
        }

        @Test
        @DisplayName("braces on the line after the block name are accepted")
        void braceOnNextLine() {
            var report = validator.validate("DEFINE_SYMBOLS\n{\n  Q=\"Query\"\n}\nWR_SECT(Q)");

            assertTrue(report.valid(), () -> "unexpected errors: " + report.errors());
            assertEquals(List.of("Q"), report.generationOrder());
            assertEquals("Query", report.parsed().orElseThrow().symbols().get("Q").label());
        }
    }

    @Nested
    @DisplayName("Structural errors")
    class Structural {

        @Test
        @DisplayName("a script without DEFINE_SYMBOLS is rejected")
        void missingSymbols() {
            var report = validator.validate("WR_SECT(A)");
            assertFalse(report.valid());
            assertEquals(List.of(ErrorKind.STRUCTURAL), kinds(report.errors()));
            assertEquals("Missing DEFINE_SYMBOLS block", report.errors().get(0).message());
            assertTrue(report.parsed().isEmpty());
        }

        @Test
        @DisplayName("a script without any WR_SECT is rejected")
        void missingSections() {
            var report = validator.validate("DEFINE_SYMBOLS{A=\"Answer\"}");
            assertEquals("Missing WR_SECT directive", report.errors().get(0).message());
        }

        @Test
        @DisplayName("an empty script reports both missing blocks")
        void emptyScript() {
            var report = validator.validate("");
            assertEquals(List.of(ErrorKind.STRUCTURAL, ErrorKind.STRUCTURAL), kinds(report.errors()));
        }

        @Test
        @DisplayName("unbalanced delimiters stop validation before symbols are checked")
        void unbalanced() {
            var report = validator.validate("DEFINE_SYMBOLS{A=\"Answer\"}\nWR_SECT(Z, d=\"x\"");
            assertFalse(report.valid());
            assertTrue(kinds(report.errors()).stream().allMatch(k -> k == ErrorKind.STRUCTURAL));
        }
    }

    @Nested
    @DisplayName("Symbol and graph errors")
    class SymbolsAndGraph {

        @Test
        @DisplayName("a section naming an undefined symbol is rejected")
        void undefinedSection() {
            var report = validator.validate("DEFINE_SYMBOLS{A=\"Answer\"}\nWR_SECT(B)");
            assertEquals(List.of(ErrorKind.UNDEFINED_SYMBOL), kinds(report.errors()));
            assertEquals("Symbol 'B' used in WR_SECT at line 2 is not defined in DEFINE_SYMBOLS",
                    report.errors().get(0).message());
        }

        @Test
        @DisplayName("a memory-graph edge naming an undefined symbol is rejected")
        void undefinedInGraph() {
            var report = validator.validate("DEFINE_SYMBOLS{A=\"Answer\"}\nMEM_GRAPH{A -> X}\nWR_SECT(A)");
            assertEquals(List.of(ErrorKind.UNDEFINED_SYMBOL), kinds(report.errors()));
        }

        @Test
        @DisplayName("a cyclic memory graph is rejected")
        void cycle() {
            var report = validator.validate("""
                    DEFINE_SYMBOLS{A="A", B="B"}
                    MEM_GRAPH{A -> B; B -> A}
                    WR_SECT(A)
                    WR_SECT(B)
                    """);
            assertEquals(List.of(ErrorKind.CYCLIC_DEPENDENCY), kinds(report.errors()));
            assertTrue(report.errors().get(0).message().contains("A, B"));
        }

        @Test
        @DisplayName("undefined symbols are reported before cycles are looked for")
        void undefinedBeforeCycle() {
            var report = validator.validate("""
                    DEFINE_SYMBOLS{A="A"}
                    MEM_GRAPH{A -> A; A -> Q}
                    WR_SECT(A)
                    """);
            assertEquals(List.of(ErrorKind.UNDEFINED_SYMBOL), kinds(report.errors()));
        }
    }
}
