package com.github.salilvnair.proofgen.engine.guard.core;

import java.util.Map;

/**
 * What a guard's check returns. The kernel turns it into a {@link GuardVerdict}.
 */
public record GuardOutcome(
        boolean passed,
        String diagnostic,
        GuardViolation violation,
        Map<String, Object> metadata
) {

    public GuardOutcome {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static GuardOutcome pass(String diagnostic) {
        return new GuardOutcome(true, diagnostic, null, Map.of());
    }

    public static GuardOutcome pass(String diagnostic, Map<String, Object> metadata) {
        return new GuardOutcome(true, diagnostic, null, metadata);
    }

    public static GuardOutcome fail(GuardViolation violation, String diagnostic) {
        return new GuardOutcome(false, diagnostic, violation, Map.of());
    }

    public static GuardOutcome fail(GuardViolation violation, String diagnostic, Map<String, Object> metadata) {
        return new GuardOutcome(false, diagnostic, violation, metadata);
    }
}
