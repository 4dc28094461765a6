package com.github.salilvnair.proofgen.engine.render;

import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;

/**
 * Either a rendered artifact or the collaborator failure that prevented it.
 */
public record RenderAttempt(GenerationRule rule, RenderedArtifact artifact, ProofGenException failure) {

    public static RenderAttempt success(RenderedArtifact artifact) {
        return new RenderAttempt(artifact.rule(), artifact, null);
    }

    public static RenderAttempt failed(GenerationRule rule, ProofGenException failure) {
        return new RenderAttempt(rule, null, failure);
    }

    public boolean succeeded() {
        return artifact != null;
    }
}
