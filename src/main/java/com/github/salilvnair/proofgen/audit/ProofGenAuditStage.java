package com.github.salilvnair.proofgen.audit;

public enum ProofGenAuditStage {
    RUN_STARTED,
    DISCOVERY_COMPLETE,
    GUARD_PASS,
    GUARD_FAIL,
    GUARD_SKIP,
    GUARD_ERROR,
    GUARDS_COMPLETE,
    RUN_BLOCKED,
    ARTIFACT_WRITTEN,
    ARTIFACT_UNCHANGED,
    ARTIFACT_SKIPPED,
    TRACKER_SAVED,
    RECEIPT_WRITTEN,
    RUN_COMPLETE,
    RUN_FAILED,
    VERIFY_COMPLETE;

    public String value() {
        return name();
    }
}
