package com.github.salilvnair.proofgen.engine.exception;

import lombok.Getter;

@Getter
public class ReceiptIntegrityException extends ProofGenException {

    private final String recordedId;
    private final String computedId;

    public ReceiptIntegrityException(String recordedId, String computedId) {
        super(ProofGenErrorCode.RECEIPT_INTEGRITY_FAILED,
                "Receipt id mismatch: recorded=" + recordedId + " computed=" + computedId);
        this.recordedId = recordedId;
        this.computedId = computedId;
    }
}
