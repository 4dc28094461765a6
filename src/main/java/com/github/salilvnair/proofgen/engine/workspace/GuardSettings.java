package com.github.salilvnair.proofgen.engine.workspace;

import lombok.Builder;
import lombok.Getter;

/**
 * Effective guard limits for one run: application defaults overlaid with the workspace {@code [guards]} section.
 */
@Getter
@Builder(toBuilder = true)
public class GuardSettings {
    private final boolean failFast;
    private final int maxOutputFiles;
    private final long maxOutputBytes;
    private final long maxFileBytes;
    private final long maxOntologyBytes;
    private final long maxTemplateBytes;
    private final long maxQueryBytes;
}
