package com.github.salilvnair.proofgen.engine.guard.core;

import java.util.function.Function;

/**
 * A named safety check evaluated before anything is generated.
 * <p>
 * {@link #check} must be free of side effects. An ordinary problem is reported as a failed
 * {@link GuardOutcome}; throwing is reserved for infrastructure failures and aborts the run.
 */
public interface Guard {

    String id();

    String name();

    GuardOutcome check(GuardContext context);

    default String remediation(GuardOutcome outcome) {
        return null;
    }

    static Guard of(String id,
                    String name,
                    Function<GuardContext, GuardOutcome> check,
                    Function<GuardOutcome, String> remediation) {
        return new FunctionalGuard(id, name, check, remediation);
    }
}
