package com.github.salilvnair.proofgen.engine.render;

import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;

import java.nio.charset.StandardCharsets;

public record RenderedArtifact(
        GenerationRule rule,
        String content,
        String contentHash,
        int rowCount,
        long extractMs,
        long renderMs
) {

    public byte[] bytes() {
        return content.getBytes(StandardCharsets.UTF_8);
    }

    public long sizeBytes() {
        return bytes().length;
    }
}
