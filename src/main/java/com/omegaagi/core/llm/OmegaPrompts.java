package com.omegaagi.core.llm;

/**
 * Prompt fragments shared by the calls that read or write whole scripts.
 */
public final class OmegaPrompts {

    private OmegaPrompts() {}

    public static final String EXPERT_ROLE = "You are an expert in the Omega-AGI symbolic language.";

    /** Compact grammar reference so the backend writes scripts this interpreter accepts. */
    public static final String SYNTAX_GUIDE = """
            Omega script syntax:
            - DEFINE_SYMBOLS{Q="Query": optional description, A="Answer"} defines every symbol. Required.
            - MEM_GRAPH{A -> [Q, B]; B -> Q} declares dependencies: A is written after Q and B.
            - WR_SECT(Q, t="Title", d="What to write") asks for one section per symbol. At least one is required.
            - EVAL_SECT(Q, th=90, iter=2) sets a quality threshold (0-100) and a maximum number of rewrites.
            - Other upper-case directives such as ROLE(...) or AUDIENCE(...) apply to the whole script.
            - Every symbol used in MEM_GRAPH, WR_SECT or EVAL_SECT must be defined; the graph must not contain cycles.
            - Comments use /* ... */ or //. Strings use double quotes.
            """;

    public static final String SCRIPT_ONLY = "Reply with the Omega script only, without explanations or code fences.";
}
