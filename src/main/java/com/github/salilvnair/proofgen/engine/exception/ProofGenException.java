package com.github.salilvnair.proofgen.engine.exception;

import lombok.Getter;

import java.util.Map;

@Getter
public class ProofGenException extends RuntimeException {

    private final String errorCode;
    private final boolean recoverable;
    private Map<String, Object> metaData;

    public ProofGenException(ProofGenErrorCode code) {
        super(code.defaultMessage());
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ProofGenException(ProofGenErrorCode code, String overrideMessage) {
        super(overrideMessage);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ProofGenException(ProofGenErrorCode code, String overrideMessage, Throwable cause) {
        super(overrideMessage, cause);
        this.errorCode = code.name();
        this.recoverable = code.recoverable();
    }

    public ProofGenException withMetaData(Map<String, Object> metaData) {
        this.metaData = metaData;
        return this;
    }

}
