package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.engine.exception.GraphParseException;
import com.github.salilvnair.proofgen.engine.graph.OntologyGraph;
import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.workspace.InputKind;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * G4: every ontology file parses as Turtle.
 */
@BuiltInGuard
@MustRunAfter(TemplateCompileGuard.class)
@Component
public class GraphParseGuard implements Guard {

    public static final String ID = "G4";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Turtle Parse";
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        int files = context.getWorkspace().inputsOf(InputKind.ONTOLOGY).size();
        Optional<GraphParseException> failure = context.graphFailure();
        if (failure.isPresent()) {
            return GuardOutcome.fail(GuardViolation.GRAPH_PARSE_ERROR,
                    failure.get().getMessage(),
                    Map.of("files", files, "source", failure.get().getSource()));
        }
        OntologyGraph graph = context.graph();
        return GuardOutcome.pass(files + " ontology files parsed, " + graph.tripleCount() + " triples",
                Map.of("files", files, "triple_count", graph.tripleCount()));
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return "Fix the Turtle syntax at the reported position";
    }
}
