package com.github.salilvnair.proofgen.engine.guard.core;

/**
 * @param executeQueries when false the query guard only parses, it does not run against the graph
 */
public record GuardOptions(
        boolean failFast,
        boolean force,
        boolean validateOnly,
        boolean executeQueries
) {

    /** Force always evaluates every guard. */
    public boolean haltOnFailure() {
        return failFast && !force;
    }

    /** Whether guards may run queries and render templates. */
    public boolean mayExecute() {
        return !validateOnly || executeQueries;
    }
}
