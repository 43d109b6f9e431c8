package com.omegaagi.dispatch.cli;

import com.omegaagi.core.engine.OmegaInterpreter;
import com.omegaagi.core.error.CorrectionExhaustedException;
import com.omegaagi.core.error.OmegaException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: omega correct &lt;file&gt;
 * <p>
 * Repairs an invalid script and prints it, or writes it to {@code --output}.
 */
@Command(name = "correct", mixinStandardHelpOptions = true, description = "Repair an invalid Omega script")
@Component
public class CorrectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the script file")
    private Path file;

    @Option(names = {"--model", "-m"}, description = "Model to use (defaults to omega.default-model)")
    private String model;

    @Option(names = {"--output", "-o"}, description = "Write the corrected script to this file")
    private Path output;

    private final OmegaInterpreter interpreter;

    public CorrectCommand(OmegaInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    @Override
    public Integer call() {
        try {
            var result = interpreter.correct(ScriptFiles.read(file), model);
            if (result.attempts() == 0) {
                ConsoleOutput.success("Script is already valid");
            } else {
                ConsoleOutput.success("Corrected after " + result.attempts() + " attempt"
                        + (result.attempts() == 1 ? "" : "s"));
            }
            if (output != null) {
                ScriptFiles.write(output, result.correctedScript());
                ConsoleOutput.info("Written to " + output);
            } else {
                System.out.println(result.correctedScript());
            }
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("I/O error: " + e.getMessage());
            return 2;
        } catch (CorrectionExhaustedException e) {
            ConsoleOutput.error(e.getMessage());
            e.remainingErrors().forEach(ConsoleOutput::validationError);
            return 1;
        } catch (OmegaException e) {
            ConsoleOutput.error(e.kind().displayName() + ": " + e.getMessage());
            return 1;
        }
    }
}
