package com.omegaagi.dispatch.cli;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.IFactory;

/**
 * Runs the {@code omega} command line inside the Spring context.
 * <p>
 * The picocli exit code (0 success, 1 script or backend failure, 2 usage error)
 * becomes the process exit code through {@link ExitCodeGenerator}.
 */
@Component
public class CliRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CliRunner.class);

    static final String SERVE = "serve";

    private final OmegaCommand omegaCommand;
    private final IFactory factory;
    private int exitCode;

    public CliRunner(OmegaCommand omegaCommand, IFactory factory) {
        this.omegaCommand = omegaCommand;
        this.factory = factory;
    }

    /**
     * True when the subcommand is {@code serve}. Only the first non-option argument
     * names the subcommand, so {@code omega run serve} runs a script file called "serve".
     */
    public static boolean isServeMode(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("-")) {
                return SERVE.equals(arg);
            }
        }
        return false;
    }

    @Override
    public void run(String... args) {
        // the embedded web server keeps the JVM alive; picocli would return at once
        if (isServeMode(args)) {
            log.debug("Serve mode, skipping command line dispatch");
            return;
        }
        exitCode = new CommandLine(omegaCommand, factory).execute(args);
        log.debug("omega {} finished with exit code {}", args.length > 0 ? args[0] : "", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
