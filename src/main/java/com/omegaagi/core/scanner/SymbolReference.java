package com.omegaagi.core.scanner;

/**
 * A use of a symbol token somewhere in the script, checked against the symbol table.
 *
 * @param token the referenced token
 * @param site  where it was used, for error messages (e.g. "WR_SECT at line 7")
 */
public record SymbolReference(String token, String site) {}
