package com.omegaagi.dispatch.cli;

import com.omegaagi.core.engine.OmegaInterpreter;
import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.error.ScriptValidationException;
import com.omegaagi.core.events.EventBus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: omega run &lt;file&gt;
 * <p>
 * Executes a script and prints the assembled text. Progress events are shown with
 * {@code --watch}.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Execute an Omega script")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the script file")
    private Path file;

    @Option(names = {"--model", "-m"}, description = "Model to use (defaults to omega.default-model)")
    private String model;

    @Option(names = {"--watch", "-w"}, description = "Print progress events while running")
    private boolean watch;

    private final OmegaInterpreter interpreter;
    private final EventBus eventBus;

    public RunCommand(OmegaInterpreter interpreter, EventBus eventBus) {
        this.interpreter = interpreter;
        this.eventBus = eventBus;
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

        EventBus.Subscription subscription = watch ? eventBus.subscribeAll(ConsoleOutput::event) : null;
        try {
            var result = interpreter.execute(script, model);
            System.out.println(result.text());
            result.warnings().forEach(ConsoleOutput::warning);
            return 0;
        } catch (ScriptValidationException e) {
            ConsoleOutput.error("Script is invalid:");
            e.errors().forEach(ConsoleOutput::validationError);
            return 1;
        } catch (OmegaException e) {
            ConsoleOutput.error(e.kind().displayName() + ": " + e.getMessage());
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
    }
}
