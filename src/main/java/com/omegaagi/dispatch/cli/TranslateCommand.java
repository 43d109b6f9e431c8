package com.omegaagi.dispatch.cli;

import com.omegaagi.core.error.OmegaException;
import com.omegaagi.core.translate.ScriptTranslator;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: omega translate "&lt;instructions&gt;"
 * <p>
 * Writes an Omega script for natural-language instructions.
 */
@Command(name = "translate", mixinStandardHelpOptions = true,
        description = "Write an Omega script from natural-language instructions")
@Component
public class TranslateCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", description = "Natural-language instructions")
    private List<String> words;

    @Option(names = {"--model", "-m"}, description = "Model to use (defaults to omega.default-model)")
    private String model;

    private final ScriptTranslator translator;

    public TranslateCommand(ScriptTranslator translator) {
        this.translator = translator;
    }

    @Override
    public Integer call() {
        try {
            System.out.println(translator.humanToOmega(String.join(" ", words), model));
            return 0;
        } catch (OmegaException e) {
            ConsoleOutput.error(e.kind().displayName() + ": " + e.getMessage());
            return 1;
        }
    }
}
