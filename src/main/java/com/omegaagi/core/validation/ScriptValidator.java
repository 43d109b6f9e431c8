package com.omegaagi.core.validation;

import com.omegaagi.core.error.CyclicDependencyException;
import com.omegaagi.core.graph.DependencyGraphResolver;
import com.omegaagi.core.model.RawScript;
import com.omegaagi.core.model.ValidationError;
import com.omegaagi.core.model.ValidationReport;
import com.omegaagi.core.scanner.DirectiveParser;
import com.omegaagi.core.scanner.ScriptParser;
import com.omegaagi.core.scanner.ScriptScanner;
import com.omegaagi.core.scanner.SymbolReference;
import com.omegaagi.core.scanner.SymbolTableBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Structural and semantic checks run before any backend call.
 * <p>
 * Checks happen in three stages and each stage only runs when the previous one found
 * nothing:
 * <ol>
 *   <li>delimiters, comments and strings are closed; the required blocks exist</li>
 *   <li>entries are well formed; every referenced symbol is defined</li>
 *   <li>the memory graph is acyclic</li>
 * </ol>
 * Never touches the backend, so it doubles as a dry run.
 */
@Service
public class ScriptValidator {

    private static final Logger log = LoggerFactory.getLogger(ScriptValidator.class);

    private final ScriptScanner scanner;
    private final ScriptParser parser;
    private final DependencyGraphResolver resolver;

    public ScriptValidator(ScriptScanner scanner, ScriptParser parser, DependencyGraphResolver resolver) {
        this.scanner = scanner;
        this.parser = parser;
        this.resolver = resolver;
    }

    public ValidationReport validate(String script) {
        return validate(RawScript.of(script));
    }

    public ValidationReport validate(RawScript script) {
        var scan = scanner.scan(script);
        var errors = new ArrayList<>(scan.errors());
        if (!scan.hasBlock(SymbolTableBuilder.BLOCK_NAME)) {
            errors.add(ValidationError.structural("Missing " + SymbolTableBuilder.BLOCK_NAME + " block"));
        }
        if (!scan.hasBlock(DirectiveParser.SECTION_DIRECTIVE)) {
            errors.add(ValidationError.structural("Missing " + DirectiveParser.SECTION_DIRECTIVE + " directive"));
        }
        if (!errors.isEmpty()) {
            return reject(errors);
        }

        var outcome = parser.parse(script, scan);
        errors.addAll(outcome.errors());
        var symbols = outcome.script().symbols();
        var reported = new LinkedHashSet<String>();
        for (SymbolReference reference : outcome.references()) {
            if (!symbols.containsKey(reference.token())
                    && reported.add(reference.token() + "@" + reference.site())) {
                errors.add(ValidationError.undefinedSymbol("Symbol '" + reference.token() + "' used in "
                        + reference.site() + " is not defined in " + SymbolTableBuilder.BLOCK_NAME));
            }
        }
        if (!errors.isEmpty()) {
            return reject(errors);
        }

        try {
            var order = resolver.resolve(outcome.script());
            log.debug("Script valid: {} sections, generation order {}", outcome.script().sections().size(), order);
            return ValidationReport.valid(outcome.script(), order);
        } catch (CyclicDependencyException e) {
            errors.add(ValidationError.cyclicDependency(e.getMessage()));
            return reject(errors);
        }
    }

    private ValidationReport reject(List<ValidationError> errors) {
        log.info("Script rejected with {} error(s): {}", errors.size(), errors);
        return ValidationReport.invalid(errors);
    }
}
