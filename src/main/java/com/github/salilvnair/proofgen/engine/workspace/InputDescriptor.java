package com.github.salilvnair.proofgen.engine.workspace;

/**
 * One declared input of a run. {@code path} is workspace-relative with {@code /} separators.
 */
public record InputDescriptor(
        String path,
        String contentHash,
        long sizeBytes,
        InputKind kind
) {
}
