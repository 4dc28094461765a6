package com.github.salilvnair.proofgen.engine.workspace;

public record GenerationRule(
        String name,
        String query,
        String template,
        String output
) {
}
