package com.github.salilvnair.proofgen.engine.exception;

import com.github.salilvnair.proofgen.engine.guard.core.GuardVerdict;
import lombok.Getter;

import java.util.List;

/**
 * Raised by the orchestrator when the guard kernel reports an overall failure and the run was not forced.
 * Carries the offending guard id and the complete, ordered verdict list.
 */
@Getter
public class GuardFailureException extends ProofGenException {

    private final String failedGuardId;
    private final List<GuardVerdict> verdicts;

    public GuardFailureException(String failedGuardId, List<GuardVerdict> verdicts) {
        super(ProofGenErrorCode.GUARD_FAILURE, "Generation blocked by guard " + failedGuardId);
        this.failedGuardId = failedGuardId;
        this.verdicts = List.copyOf(verdicts);
    }
}
