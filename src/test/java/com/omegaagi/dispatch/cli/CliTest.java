package com.omegaagi.dispatch.cli;

import com.omegaagi.core.engine.OmegaInterpreter;
import com.omegaagi.core.error.BackendUnavailableException;
import com.omegaagi.core.error.CorrectionExhaustedException;
import com.omegaagi.core.error.ScriptValidationException;
import com.omegaagi.core.events.EventBus;
import com.omegaagi.core.model.CorrectionResult;
import com.omegaagi.core.model.ExecutionResult;
import com.omegaagi.core.model.ValidationError;
import com.omegaagi.core.model.ValidationReport;
import com.omegaagi.core.translate.ScriptTranslator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the CLI commands using picocli's CommandLine.execute() with mocked services.
 */
class CliTest {

    private static final String SCRIPT = "DEFINE_SYMBOLS{A=\"Intro\"}; WR_SECT(A, t=\"x\", d=\"y\");";

    private record CliResult(int exitCode, String output) {}

    @TempDir
    Path tempDir;

    private OmegaInterpreter interpreter;
    private ScriptTranslator translator;
    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        interpreter = mock(OmegaInterpreter.class);
        translator = mock(ScriptTranslator.class);
        eventBus = new EventBus();
    }

    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) {
                    return (K) new RunCommand(interpreter, eventBus);
                }
                if (cls == ValidateCommand.class) {
                    return (K) new ValidateCommand(interpreter);
                }
                if (cls == CorrectCommand.class) {
                    return (K) new CorrectCommand(interpreter);
                }
                if (cls == TranslateCommand.class) {
                    return (K) new TranslateCommand(translator);
                }
                if (cls == ExplainCommand.class) {
                    return (K) new ExplainCommand(translator);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true, StandardCharsets.UTF_8);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new OmegaCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private Path writeScript(String content) throws IOException {
        Path file = tempDir.resolve("script.omega");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists all subcommands")
        void helpListsSubcommands() {
            var result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String name : List.of("run", "validate", "correct", "translate", "explain", "serve")) {
                assertTrue(result.output().contains(name), "help should mention " + name);
            }
        }

        @Test
        @DisplayName("--version prints the version string")
        void versionPrintsVersion() {
            var result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Omega-AGI 0.1.0"));
        }

        @Test
        @DisplayName("no arguments prints banner and usage")
        void noArgumentsPrintsUsage() {
            var result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("OMEGA-AGI"));
            assertTrue(result.output().contains("Usage:"));
        }
    }

    @Nested
    @DisplayName("validate")
    class ValidateTests {

        @Test
        @DisplayName("valid script exits 0 and prints the generation order")
        void validScript() throws IOException {
            Path file = writeScript(SCRIPT);
            when(interpreter.validate(SCRIPT)).thenReturn(ValidationReport.valid(null, List.of("B", "A")));

            var result = execute("validate", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Script is valid"));
            assertTrue(result.output().contains("Generation order: B -> A"));
        }

        @Test
        @DisplayName("invalid script exits 1 and lists every error")
        void invalidScript() throws IOException {
            Path file = writeScript(SCRIPT);
            when(interpreter.validate(SCRIPT)).thenReturn(ValidationReport.invalid(List.of(
                    ValidationError.undefinedSymbol("Symbol 'X' is not defined"),
                    ValidationError.structural("Missing WR_SECT directive"))));

            var result = execute("validate", file.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Script is invalid (2 errors):"));
            assertTrue(result.output().contains("UndefinedSymbolError"));
            assertTrue(result.output().contains("Symbol 'X' is not defined"));
        }

        @Test
        @DisplayName("missing file exits 2 without touching the interpreter")
        void missingFile() {
            var result = execute("validate", tempDir.resolve("absent.omega").toString());

            assertEquals(2, result.exitCode());
            assertTrue(result.output().contains("Cannot read"));
            verifyNoInteractions(interpreter);
        }
    }

    @Nested
    @DisplayName("run")
    class RunTests {

        @Test
        @DisplayName("prints the assembled text followed by warnings")
        void printsTextAndWarnings() throws IOException {
            Path file = writeScript(SCRIPT);
            when(interpreter.execute(SCRIPT, null)).thenReturn(
                    new ExecutionResult("Hello world", List.of("QualityThresholdUnmet: A scored 70 < 80")));

            var result = execute("run", file.toString());

            assertEquals(0, result.exitCode());
            int text = result.output().indexOf("Hello world");
            int warning = result.output().indexOf("QualityThresholdUnmet");
            assertTrue(text >= 0);
            assertTrue(warning > text);
        }

        @Test
        @DisplayName("passes the model option through")
        void passesModel() throws IOException {
            Path file = writeScript(SCRIPT);
            when(interpreter.execute(anyString(), anyString())).thenReturn(new ExecutionResult("ok", List.of()));

            var result = execute("run", file.toString(), "-m", "gpt-4o-mini");

            assertEquals(0, result.exitCode());
            verify(interpreter).execute(SCRIPT, "gpt-4o-mini");
        }

        @Test
        @DisplayName("validation failure exits 1 and lists errors")
        void validationFailure() throws IOException {
            Path file = writeScript(SCRIPT);
            when(interpreter.execute(SCRIPT, null)).thenThrow(new ScriptValidationException(
                    List.of(ValidationError.cyclicDependency("Cycle between A, B"))));

            var result = execute("run", file.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Script is invalid"));
            assertTrue(result.output().contains("Cycle between A, B"));
        }

        @Test
        @DisplayName("backend failure exits 1 with the error kind")
        void backendFailure() throws IOException {
            Path file = writeScript(SCRIPT);
            when(interpreter.execute(SCRIPT, null)).thenThrow(new BackendUnavailableException("connection refused"));

            var result = execute("run", file.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("BackendUnavailableError"));
            assertTrue(result.output().contains("connection refused"));
        }
    }

    @Nested
    @DisplayName("correct")
    class CorrectTests {

        @Test
        @DisplayName("prints the corrected script")
        void printsCorrectedScript() throws IOException {
            Path file = writeScript("broken");
            when(interpreter.correct("broken", null)).thenReturn(new CorrectionResult(SCRIPT, 1));

            var result = execute("correct", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Corrected after 1 attempt"));
            assertTrue(result.output().contains(SCRIPT));
        }

        @Test
        @DisplayName("--output writes the corrected script to a file")
        void writesOutputFile() throws IOException {
            Path file = writeScript("broken");
            Path out = tempDir.resolve("fixed.omega");
            when(interpreter.correct("broken", null)).thenReturn(new CorrectionResult(SCRIPT, 2));

            var result = execute("correct", file.toString(), "-o", out.toString());

            assertEquals(0, result.exitCode());
            assertEquals(SCRIPT, Files.readString(out, StandardCharsets.UTF_8));
            assertTrue(result.output().contains("Written to"));
        }

        @Test
        @DisplayName("already valid script reports zero attempts")
        void alreadyValid() throws IOException {
            Path file = writeScript(SCRIPT);
            when(interpreter.correct(SCRIPT, null)).thenReturn(new CorrectionResult(SCRIPT, 0));

            var result = execute("correct", file.toString());

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Script is already valid"));
        }

        @Test
        @DisplayName("exhausted correction exits 1 with remaining errors")
        void exhausted() throws IOException {
            Path file = writeScript("broken");
            when(interpreter.correct("broken", null)).thenThrow(new CorrectionExhaustedException(3,
                    List.of(ValidationError.structural("Missing DEFINE_SYMBOLS block"))));

            var result = execute("correct", file.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("after 3 correction attempts"));
            assertTrue(result.output().contains("Missing DEFINE_SYMBOLS block"));
        }
    }

    @Nested
    @DisplayName("translate and explain")
    class TranslationTests {

        @Test
        @DisplayName("translate joins the words into one instruction")
        void translateJoinsWords() {
            when(translator.humanToOmega("write a short poem", null)).thenReturn(SCRIPT);

            var result = execute("translate", "write", "a", "short", "poem");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains(SCRIPT));
        }

        @Test
        @DisplayName("translate without words is a usage error")
        void translateWithoutWords() {
            var result = execute("translate");

            assertEquals(2, result.exitCode());
            verifyNoInteractions(translator);
        }

        @Test
        @DisplayName("explain prints the plain-language description")
        void explainPrintsDescription() throws IOException {
            Path file = writeScript(SCRIPT);
            when(translator.omegaToHuman(SCRIPT, "gpt-4o")).thenReturn("Writes an intro section.");

            var result = execute("explain", file.toString(), "--model", "gpt-4o");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Writes an intro section."));
        }

        @Test
        @DisplayName("explain of an empty file exits 1")
        void explainEmptyFile() throws IOException {
            Path file = writeScript("");
            when(translator.omegaToHuman(eq(""), any())).thenThrow(new IllegalArgumentException("No script given"));

            var result = execute("explain", file.toString());

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("is empty"));
        }
    }

    @Nested
    @DisplayName("CliRunner")
    class RunnerTests {

        @Test
        @DisplayName("only the subcommand position selects serve mode")
        void serveModeDetection() {
            assertTrue(CliRunner.isServeMode("serve"));
            assertTrue(CliRunner.isServeMode("--verbose", "serve"));
            assertFalse(CliRunner.isServeMode("run", "serve"));
            assertFalse(CliRunner.isServeMode("validate", "serve.omega"));
            assertFalse(CliRunner.isServeMode());
        }

        @Test
        @DisplayName("serve mode skips command dispatch")
        void serveSkipsDispatch() {
            var runner = new CliRunner(new OmegaCommand(), createFactory());

            runner.run("serve");

            assertEquals(0, runner.getExitCode());
            verifyNoInteractions(interpreter, translator);
        }

        @Test
        @DisplayName("a script file named serve is validated, and its exit code is kept")
        void scriptNamedServe() throws IOException {
            Path file = tempDir.resolve("serve");
            Files.writeString(file, SCRIPT, StandardCharsets.UTF_8);
            when(interpreter.validate(SCRIPT)).thenReturn(ValidationReport.invalid(List.of(
                    ValidationError.structural("Missing WR_SECT directive"))));
            var runner = new CliRunner(new OmegaCommand(), createFactory());

            PrintStream originalOut = System.out;
            PrintStream originalErr = System.err;
            PrintStream sink = new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8);
            System.setOut(sink);
            System.setErr(sink);
            try {
                runner.run("validate", file.toString());
            } finally {
                System.setOut(originalOut);
                System.setErr(originalErr);
            }

            assertEquals(1, runner.getExitCode());
            verify(interpreter).validate(SCRIPT);
        }
    }
}
