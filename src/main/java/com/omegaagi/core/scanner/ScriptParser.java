package com.omegaagi.core.scanner;

import com.omegaagi.core.config.OmegaProperties;
import com.omegaagi.core.model.ParsedScript;
import com.omegaagi.core.model.RawScript;
import com.omegaagi.core.model.SectionDirective;
import com.omegaagi.core.model.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Turns scanned blocks into a {@link ParsedScript}.
 * <p>
 * Blocks whose name is an upper-case identifier other than the four known directives
 * are kept verbatim as preamble directives (e.g. {@code ROLE(...)}, {@code AUTH[...]}).
 */
@Component
public class ScriptParser {

    private static final Logger log = LoggerFactory.getLogger(ScriptParser.class);

    private static final Set<String> KNOWN_BLOCKS = Set.of(
            SymbolTableBuilder.BLOCK_NAME,
            DirectiveParser.MEMORY_GRAPH,
            DirectiveParser.SECTION_DIRECTIVE,
            DirectiveParser.EVALUATION_DIRECTIVE);

    private final SymbolTableBuilder symbolTableBuilder;
    private final DirectiveParser directiveParser;
    private final OmegaProperties properties;

    public ScriptParser(SymbolTableBuilder symbolTableBuilder, DirectiveParser directiveParser,
                        OmegaProperties properties) {
        this.symbolTableBuilder = symbolTableBuilder;
        this.directiveParser = directiveParser;
        this.properties = properties;
    }

    public ParseOutcome parse(RawScript source, ScanResult scan) {
        var errors = new ArrayList<ValidationError>();
        var references = new ArrayList<SymbolReference>();

        var symbolTable = symbolTableBuilder.build(scan.blocksNamed(SymbolTableBuilder.BLOCK_NAME));
        errors.addAll(symbolTable.errors());

        var edges = directiveParser.parseGraph(scan.blocksNamed(DirectiveParser.MEMORY_GRAPH), errors, references);
        var sections = directiveParser.parseSections(
                scan.blocksNamed(DirectiveParser.SECTION_DIRECTIVE), errors, references);
        var criteria = directiveParser.parseEvaluations(
                scan.blocksNamed(DirectiveParser.EVALUATION_DIRECTIVE),
                properties.getDefaultThreshold(), properties.getDefaultMaxIterations(), errors, references);

        var sectionTokens = sections.stream().map(SectionDirective::symbol).toList();
        for (var entry : criteria.entrySet()) {
            String token = entry.getKey();
            if (symbolTable.symbols().containsKey(token) && !sectionTokens.contains(token)) {
                errors.add(ValidationError.structural(DirectiveParser.EVALUATION_DIRECTIVE + " targets '" + token
                        + "', which has no " + DirectiveParser.SECTION_DIRECTIVE));
            }
        }
        List<SectionDirective> evaluated = sections.stream()
                .map(s -> criteria.containsKey(s.symbol()) ? s.withEvaluation(criteria.get(s.symbol())) : s)
                .toList();

        List<String> preamble = scan.blocks().stream()
                .filter(b -> !KNOWN_BLOCKS.contains(b.name()) && isDirectiveName(b.name()))
                .map(ScannedBlock::raw)
                .toList();

        var script = new ParsedScript(source, preamble, symbolTable.symbols(), edges, evaluated);
        log.debug("Parsed script: {} symbols, {} edges, {} sections, {} preamble directives, {} problems",
                script.symbols().size(), edges.size(), evaluated.size(), preamble.size(), errors.size());
        return new ParseOutcome(script, errors, references);
    }

    private static boolean isDirectiveName(String name) {
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (!(Character.isUpperCase(c) || Character.isDigit(c) || c == '_')) {
                return false;
            }
        }
        return true;
    }
}
