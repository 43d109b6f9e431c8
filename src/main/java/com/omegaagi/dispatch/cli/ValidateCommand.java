package com.omegaagi.dispatch.cli;

import com.omegaagi.core.engine.OmegaInterpreter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: omega validate &lt;file&gt;
 * <p>
 * Checks a script without calling the backend. Exits 1 when it is invalid.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Check an Omega script")
@Component
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the script file")
    private Path file;

    private final OmegaInterpreter interpreter;

    public ValidateCommand(OmegaInterpreter interpreter) {
        this.interpreter = interpreter;
    }

    @Override
    public Integer call() {
        String script;
        try {
            script = ScriptFiles.read(file);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        }

        var report = interpreter.validate(script);
        if (report.valid()) {
            ConsoleOutput.success("Script is valid");
            ConsoleOutput.info("Generation order: " + String.join(" -> ", report.generationOrder()));
            return 0;
        }
        ConsoleOutput.error("Script is invalid (" + report.errors().size() + " error"
                + (report.errors().size() == 1 ? "" : "s") + "):");
        report.errors().forEach(ConsoleOutput::validationError);
        return 1;
    }
}
