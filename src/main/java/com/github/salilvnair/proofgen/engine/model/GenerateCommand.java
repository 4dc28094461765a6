package com.github.salilvnair.proofgen.engine.model;

import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@Builder(toBuilder = true)
public class GenerateCommand {

    private final Path workspaceRoot;

    /** Compute everything and write the receipt, but leave generated outputs untouched. */
    @Builder.Default
    private final boolean preview = true;

    /** Evaluate every guard, proceed past failures and ignore the tracker cache. */
    @Builder.Default
    private final boolean force = false;

    @Builder.Default
    private final boolean validate = true;

    /** Stop after the guard kernel. */
    @Builder.Default
    private final boolean validateOnly = false;
}
