package com.github.salilvnair.proofgen.engine.exception;

public enum ProofGenErrorCode {

    // =========================
    // Workspace / input errors
    // =========================
    WORKSPACE_NOT_FOUND(
            "Workspace root does not exist or is not a directory",
            false
    ),

    WORKSPACE_CONFIG_INVALID(
            "Workspace config file could not be parsed",
            false
    ),

    INPUT_NOT_FOUND(
            "Declared input file does not exist",
            false
    ),

    INPUT_READ_FAILED(
            "Failed to read declared input file",
            false
    ),

    // =========================
    // Guard kernel errors
    // =========================
    DUPLICATE_GUARD(
            "Duplicate guard registered",
            false
    ),

    MISSING_DEPENDENT_GUARD(
            "Guard depends on a guard that is not registered",
            false
    ),

    GUARD_ORDER_CYCLE(
            "Guard ordering contains a cycle",
            false
    ),

    GUARD_EXECUTION_FAILED(
            "Guard aborted with an infrastructure error",
            false
    ),

    // =========================
    // Collaborator errors
    // =========================
    GRAPH_PARSE_FAILED(
            "Ontology file failed to parse",
            false
    ),

    QUERY_EXECUTION_FAILED(
            "Query failed to parse or execute",
            false
    ),

    TEMPLATE_COMPILE_FAILED(
            "Template failed to compile",
            false
    ),

    TEMPLATE_RENDER_FAILED(
            "Template failed to render",
            false
    ),

    OUTPUT_VALIDATION_FAILED(
            "Rendered output failed validation",
            false
    ),

    OUTPUT_WRITE_FAILED(
            "Failed to write generated output",
            true
    ),

    // =========================
    // Tracker / receipt errors
    // =========================
    TRACKER_STATE_CORRUPT(
            "Artifact tracker state file is corrupt, starting empty",
            true
    ),

    TRACKER_SAVE_FAILED(
            "Failed to persist artifact tracker state",
            true
    ),

    RECEIPT_WRITE_FAILED(
            "Failed to write receipt",
            true
    ),

    RECEIPT_READ_FAILED(
            "Failed to read receipt",
            false
    ),

    RECEIPT_INTEGRITY_FAILED(
            "Receipt id does not match receipt content",
            false
    ),

    // =========================
    // Pipeline
    // =========================
    GUARD_FAILURE(
            "Generation blocked by guard failure",
            false
    ),

    RUN_CANCELLED(
            "Generation run was cancelled",
            true
    );

    private final String defaultMessage;
    private final boolean recoverable;

    ProofGenErrorCode(String defaultMessage, boolean recoverable) {
        this.defaultMessage = defaultMessage;
        this.recoverable = recoverable;
    }

    public String defaultMessage() {
        return defaultMessage;
    }

    public boolean recoverable() {
        return recoverable;
    }
}
