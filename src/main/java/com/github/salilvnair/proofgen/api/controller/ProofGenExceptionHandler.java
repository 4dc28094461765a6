package com.github.salilvnair.proofgen.api.controller;

import com.github.salilvnair.proofgen.api.dto.ErrorResponse;
import com.github.salilvnair.proofgen.engine.exception.GuardFailureException;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Set;

@Slf4j
@RestControllerAdvice(assignableTypes = ProofGenController.class)
public class ProofGenExceptionHandler {

    private static final Set<String> CLIENT_ERRORS = Set.of(
            ProofGenErrorCode.WORKSPACE_NOT_FOUND.name(),
            ProofGenErrorCode.WORKSPACE_CONFIG_INVALID.name(),
            ProofGenErrorCode.INPUT_NOT_FOUND.name(),
            ProofGenErrorCode.OUTPUT_VALIDATION_FAILED.name(),
            ProofGenErrorCode.RECEIPT_READ_FAILED.name());

    @ExceptionHandler(GuardFailureException.class)
    public ResponseEntity<ErrorResponse> guardFailure(GuardFailureException ex) {
        ErrorResponse body = base(ex);
        body.setFailedGuardId(ex.getFailedGuardId());
        body.setVerdicts(ex.getVerdicts());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(ProofGenException.class)
    public ResponseEntity<ErrorResponse> proofGenFailure(ProofGenException ex) {
        HttpStatus status = CLIENT_ERRORS.contains(ex.getErrorCode())
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("ProofGen request failed: {}", ex.getMessage(), ex);
        }
        return ResponseEntity.status(status).body(base(ex));
    }

    private static ErrorResponse base(ProofGenException ex) {
        ErrorResponse body = new ErrorResponse();
        body.setErrorCode(ex.getErrorCode());
        body.setMessage(ex.getMessage());
        body.setRecoverable(ex.isRecoverable());
        body.setMetaData(ex.getMetaData());
        return body;
    }
}
