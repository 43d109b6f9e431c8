package com.omegaagi.dispatch.cli;

import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.translate.ScriptTranslator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: omega explain &lt;file&gt;
 */
@Command(name = "explain", mixinStandardHelpOptions = true, description = "Explain an Omega script in plain language")
@Component
public class ExplainCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the script file")
    private Path file;

    @Option(names = {"--model", "-m"}, description = "Model to use (defaults to omega.default-model)")
    private String model;

    private final ScriptTranslator translator;

    public ExplainCommand(ScriptTranslator translator) {
        this.translator = translator;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(translator.omegaToHuman(ScriptFiles.read(file), model));
            return 0;
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 2;
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(file + " is empty");
            return 1;
        } catch (OmegaException e) {
            ConsoleOutput.error(e.kind().displayName() + ": " + e.getMessage());
            return 1;
        }
    }
}
