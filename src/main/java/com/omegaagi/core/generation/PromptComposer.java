package com.omegaagi.core.generation;

import com.omegaagi.core.model.EvaluationCriteria;
import com.omegaagi.core.model.ParsedScript;
import com.omegaagi.core.model.SectionDirective;
import com.omegaagi.core.model.Symbol;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Map;

/**
 * Builds the generation, critique and regeneration prompts for one section.
 * <p>
 * A generation prompt carries, in order: the script's preamble directives, the
 * definitions of the section's own symbol and its dependencies, the section's title,
 * instructions and constraints, and the already generated content of every dependency.
 */
@Component
public class PromptComposer {

    public String composeGeneration(ParsedScript script, SectionDirective section,
                                    Map<String, String> dependencyContent) {
        var prompt = new StringBuilder();
        prompt.append("You are writing one section of a document described by an Omega script.\n");
        appendContext(prompt, script, section, dependencyContent);
        prompt.append("\nWrite only the content of section ").append(section.symbol())
                .append(". Do not repeat the instructions or the dependency content.");
        return prompt.toString();
    }

    public String composeFeedback(ParsedScript script, SectionDirective section, String content,
                                  int score, EvaluationCriteria criteria) {
        var prompt = new StringBuilder();
        prompt.append("You are reviewing one section of a document described by an Omega script.\n");
        appendSectionInstructions(prompt, script, section);
        prompt.append("\nCurrent content:\n").append(content).append('\n');
        prompt.append("\nThis content scored ").append(score).append(" out of 100; the required threshold is ")
                .append(criteria.threshold()).append(".\n");
        prompt.append("List the concrete changes that would raise its quality. Reply with the critique only.");
        return prompt.toString();
    }

    public String composeRegeneration(ParsedScript script, SectionDirective section,
                                      Map<String, String> dependencyContent, String previousContent,
                                      String feedback) {
        var prompt = new StringBuilder();
        prompt.append("You are revising one section of a document described by an Omega script.\n");
        appendContext(prompt, script, section, dependencyContent);
        prompt.append("\nPrevious version:\n").append(previousContent).append('\n');
        prompt.append("\nReviewer feedback:\n").append(feedback).append('\n');
        prompt.append("\nRewrite section ").append(section.symbol())
                .append(" addressing the feedback. Reply with the new content only.");
        return prompt.toString();
    }

    private void appendContext(StringBuilder prompt, ParsedScript script, SectionDirective section,
                               Map<String, String> dependencyContent) {
        if (!script.preamble().isEmpty()) {
            prompt.append("\nDirectives:\n");
            script.preamble().forEach(directive -> prompt.append(directive).append('\n'));
        }

        var tokens = new LinkedHashSet<String>();
        tokens.add(section.symbol());
        tokens.addAll(script.dependenciesOf(section.symbol()));
        tokens.addAll(dependencyContent.keySet());
        prompt.append("\nSymbols:\n");
        for (String token : tokens) {
            Symbol symbol = script.symbols().get(token);
            if (symbol != null) {
                prompt.append(describe(symbol)).append('\n');
            }
        }

        appendSectionInstructions(prompt, script, section);

        for (var entry : dependencyContent.entrySet()) {
            prompt.append("\nContent of section ").append(entry.getKey()).append(":\n")
                    .append(entry.getValue()).append('\n');
        }
    }

    private void appendSectionInstructions(StringBuilder prompt, ParsedScript script, SectionDirective section) {
        Symbol symbol = script.symbols().get(section.symbol());
        prompt.append("\nSection ").append(section.symbol());
        if (!section.title().isBlank()) {
            prompt.append(" \"").append(section.title()).append('"');
        } else if (symbol != null) {
            prompt.append(" \"").append(symbol.label()).append('"');
        }
        prompt.append(":\n");
        if (!section.description().isBlank()) {
            prompt.append(section.description()).append('\n');
        }
        if (!section.constraints().isEmpty()) {
            prompt.append("Constraints:\n");
            section.constraints().forEach((key, value) ->
                    prompt.append("- ").append(key).append(": ").append(value).append('\n'));
        }
    }

    private static String describe(Symbol symbol) {
        var line = new StringBuilder(symbol.token()).append(" = \"").append(symbol.label()).append('"');
        if (symbol.hasDescription()) {
            line.append(": ").append(symbol.description());
        }
        return line.toString();
    }
}
