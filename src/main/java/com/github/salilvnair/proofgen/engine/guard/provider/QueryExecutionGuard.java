package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOptions;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.query.PreparedQuery;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * G5: every referenced query parses and executes against the loaded graph.
 * <p>
 * Execution is skipped when the graph itself failed to load, and in validate-only runs configured to
 * stop at parsing; the diagnostic says so.
 */
@BuiltInGuard
@MustRunAfter(GraphParseGuard.class)
@Component
public class QueryExecutionGuard implements Guard {

    public static final String ID = "G5";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "SPARQL Execution";
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        TreeSet<String> queries = new TreeSet<>();
        for (GenerationRule rule : context.rules()) {
            queries.add(rule.query());
        }
        GuardOptions options = context.getOptions();
        boolean execute = options.mayExecute();
        boolean graphAvailable = context.graphFailure().isEmpty();

        List<String> errors = new ArrayList<>();
        Map<String, Object> rowCounts = new LinkedHashMap<>();
        for (String query : queries) {
            if (!context.getWorkspace().isLoaded(query)) {
                errors.add(query + ": not loaded");
                continue;
            }
            try {
                PreparedQuery prepared = context.getRenderer().prepare(context.getWorkspace(), query);
                if (execute && graphAvailable) {
                    rowCounts.put(query, context.getRenderer().execute(context.graph(), prepared).size());
                }
            }
            catch (ProofGenException e) {
                errors.add(e.getMessage());
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("queries", queries.size());
        metadata.put("executed", rowCounts.size());
        metadata.put("rows", rowCounts);
        if (!errors.isEmpty()) {
            return GuardOutcome.fail(GuardViolation.QUERY_EXECUTION_ERROR, String.join("; ", errors), metadata);
        }
        String diagnostic = queries.size() + " queries parsed";
        if (!execute) {
            diagnostic += ", execution disabled in validate-only mode";
        }
        else if (!graphAvailable) {
            diagnostic += ", execution not attempted: graph unavailable";
        }
        else {
            diagnostic += " and executed";
        }
        return GuardOutcome.pass(diagnostic, metadata);
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return "Fix the query syntax and make sure every projected variable is bound in the WHERE clause";
    }
}
