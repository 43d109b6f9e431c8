package com.omegaagi.dispatch.cli;

import com.omegaagi.core.events.OmegaEvent;
import com.omegaagi.core.model.ValidationError;
import picocli.CommandLine;

/**
 * ANSI-colored terminal output utilities for the Omega CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) OMEGA-AGI v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [OMEGA]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warning(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void validationError(ValidationError error) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(red) " + error.kind().displayName() + "|@ " + error.message()));
    }

    public static void event(OmegaEvent event) {
        String prefix = switch (event.eventType()) {
            case OmegaEvent.EXECUTION_STARTED -> "@|fg(cyan) [START]|@";
            case OmegaEvent.SECTION_GENERATED -> "@|fg(blue) [SECTION]|@";
            case OmegaEvent.SECTION_REFINED -> "@|fg(magenta) [REFINE]|@";
            case OmegaEvent.EXECUTION_COMPLETED -> "@|fg(green),bold [COMPLETE]|@";
            case OmegaEvent.EXECUTION_FAILED -> "@|fg(red),bold [FAILED]|@";
            default -> "@|fg(white) [" + event.eventType() + "]|@";
        };
        String subject = event.section() != null ? event.section() : event.executionId();
        System.out.println(CommandLine.Help.Ansi.AUTO.string(prefix + " " + subject + " " + event.payload()));
    }
}
