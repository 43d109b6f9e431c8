package com.omegaagi.core.scanner;

import com.omegaagi.core.model.ValidationError;

import java.util.List;

/**
 * Blocks found at the top level of a script, plus any structural problems met on the way.
 */
public record ScanResult(
    List<ScannedBlock> blocks,
    List<ValidationError> errors
) {

    public ScanResult {
        blocks = List.copyOf(blocks);
        errors = List.copyOf(errors);
    }

    public List<ScannedBlock> blocksNamed(String name) {
        return blocks.stream().filter(b -> b.isNamed(name)).toList();
    }

    public boolean hasBlock(String name) {
        return blocks.stream().anyMatch(b -> b.isNamed(name));
    }
}
