package com.omegaagi.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command.
 * Routes to subcommands: run, validate, correct, translate, explain, serve.
 */
@Command(
        name = "omega",
        mixinStandardHelpOptions = true,
        version = "Omega-AGI 0.1.0",
        description = "Interpreter for Omega scripts",
        subcommands = {
                RunCommand.class,
                ValidateCommand.class,
                CorrectCommand.class,
                TranslateCommand.class,
                ExplainCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class OmegaCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // No subcommand given
        spec.commandLine().usage(System.out);
    }
}
