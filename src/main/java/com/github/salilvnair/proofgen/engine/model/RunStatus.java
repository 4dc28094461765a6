package com.github.salilvnair.proofgen.engine.model;

public enum RunStatus {
    /** Guards passed and outputs were produced. */
    COMPLETED,
    /** Outputs were produced although at least one guard failed. */
    FORCED,
    /** Validate-only run; nothing was rendered. */
    VALIDATED
}
