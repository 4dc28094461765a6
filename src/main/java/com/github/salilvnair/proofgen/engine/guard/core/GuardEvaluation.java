package com.github.salilvnair.proofgen.engine.guard.core;

import java.util.List;

public record GuardEvaluation(
        List<GuardVerdict> verdicts,
        GuardStatus overall,
        String failedGuardId,
        long durationMs
) {

    public GuardEvaluation {
        verdicts = List.copyOf(verdicts);
    }

    public boolean passed() {
        return overall == GuardStatus.PASS;
    }

    public List<GuardVerdict> failures() {
        return verdicts.stream().filter(GuardVerdict::isFail).toList();
    }

    public boolean passed(String guardId) {
        return verdicts.stream()
                .anyMatch(v -> v.guardId().equals(guardId) && v.status() == GuardStatus.PASS);
    }
}
