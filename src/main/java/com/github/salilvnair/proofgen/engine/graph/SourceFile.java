package com.github.salilvnair.proofgen.engine.graph;

public record SourceFile(String path, byte[] content) {
}
