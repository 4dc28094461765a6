package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.render.RenderAttempt;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.InputDescriptor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * G6: two independent extract-and-render passes over the same snapshot must agree byte for byte.
 * Records {@code input_hash}, a digest over every declared input.
 */
@BuiltInGuard
@MustRunAfter(QueryExecutionGuard.class)
@RequiredArgsConstructor
@Component
public class DeterminismGuard implements Guard {

    public static final String ID = "G6";

    private final ContentHasher hasher;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Determinism";
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        String inputHash = inputHash(context.getWorkspace().getInputs());
        if (!context.getOptions().mayExecute()) {
            return GuardOutcome.pass("Render comparison not performed without query execution",
                    Map.of("input_hash", inputHash, "rules", context.rules().size()));
        }
        List<String> mismatches = new ArrayList<>();
        List<String> unverifiable = new ArrayList<>();
        for (GenerationRule rule : context.rules()) {
            RenderAttempt first = context.render(rule);
            RenderAttempt second = context.renderFresh(rule);
            if (!first.succeeded() || !second.succeeded()) {
                RenderAttempt failed = first.succeeded() ? second : first;
                unverifiable.add(rule.name() + ": " + failed.failure().getMessage());
                continue;
            }
            if (!first.artifact().contentHash().equals(second.artifact().contentHash())) {
                mismatches.add(rule.name() + " (" + first.artifact().contentHash()
                        + " != " + second.artifact().contentHash() + ")");
            }
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("input_hash", inputHash);
        metadata.put("rules", context.rules().size());
        if (!mismatches.isEmpty()) {
            return GuardOutcome.fail(GuardViolation.NON_DETERMINISM_DETECTED,
                    "Output differs between identical renders: " + String.join("; ", mismatches), metadata);
        }
        if (!unverifiable.isEmpty()) {
            return GuardOutcome.fail(GuardViolation.NON_DETERMINISM_DETECTED,
                    "Determinism could not be established: " + String.join("; ", unverifiable), metadata);
        }
        return GuardOutcome.pass(context.rules().size() + " rules render identically", metadata);
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return "Remove time, randomness and unordered iteration from templates; add ORDER BY to queries";
    }

    private String inputHash(List<InputDescriptor> inputs) {
        StringBuilder material = new StringBuilder();
        for (InputDescriptor input : inputs) {
            material.append(input.kind()).append(':')
                    .append(input.path()).append(':')
                    .append(input.contentHash()).append('\n');
        }
        return hasher.hash(material.toString());
    }
}
