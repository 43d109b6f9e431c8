package com.omegaagi.core.error;

import java.util.List;

/**
 * Thrown by the dependency resolver when the memory graph contains a cycle.
 */
public class CyclicDependencyException extends OmegaException {

    private final List<String> tokens;

    public CyclicDependencyException(List<String> tokens) {
        super(ErrorKind.CYCLIC_DEPENDENCY, "Memory graph contains a cycle involving " + String.join(", ", tokens));
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Tokens lying on a cycle, in declaration order.
     */
    public List<String> tokens() {
        return tokens;
    }
}
