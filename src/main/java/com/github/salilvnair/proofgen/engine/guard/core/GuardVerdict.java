package com.github.salilvnair.proofgen.engine.guard.core;

import java.util.Map;

public record GuardVerdict(
        String guardId,
        String guardName,
        GuardStatus status,
        String diagnostic,
        String remediation,
        GuardViolation violation,
        Map<String, Object> metadata
) {

    public GuardVerdict {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static GuardVerdict of(Guard guard, GuardOutcome outcome) {
        return new GuardVerdict(
                guard.id(),
                guard.name(),
                outcome.passed() ? GuardStatus.PASS : GuardStatus.FAIL,
                outcome.diagnostic(),
                outcome.passed() ? null : guard.remediation(outcome),
                outcome.violation(),
                outcome.metadata());
    }

    public static GuardVerdict skipped(Guard guard, String haltedBy) {
        return new GuardVerdict(
                guard.id(),
                guard.name(),
                GuardStatus.SKIP,
                "Skipped: fail-fast halted after " + haltedBy,
                null,
                null,
                Map.of());
    }

    public boolean isFail() {
        return status == GuardStatus.FAIL;
    }
}
