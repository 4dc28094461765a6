package com.github.salilvnair.proofgen.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.salilvnair.proofgen.engine.guard.core.GuardVerdict;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String errorCode;
    private String message;
    private boolean recoverable;
    private String failedGuardId;
    private List<GuardVerdict> verdicts;
    private Map<String, Object> metaData;
}
