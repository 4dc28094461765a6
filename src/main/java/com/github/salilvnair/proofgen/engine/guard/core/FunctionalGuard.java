package com.github.salilvnair.proofgen.engine.guard.core;

import java.util.Objects;
import java.util.function.Function;

final class FunctionalGuard implements Guard {

    private final String id;
    private final String name;
    private final Function<GuardContext, GuardOutcome> check;
    private final Function<GuardOutcome, String> remediation;

    FunctionalGuard(String id,
                    String name,
                    Function<GuardContext, GuardOutcome> check,
                    Function<GuardOutcome, String> remediation) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.check = Objects.requireNonNull(check, "check");
        this.remediation = remediation;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        return check.apply(context);
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return remediation == null ? null : remediation.apply(outcome);
    }

    @Override
    public String toString() {
        return "Guard[" + id + "]";
    }
}
