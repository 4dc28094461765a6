package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.WorkspacePaths;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * G2: no two rules may target the same normalized output path.
 */
@BuiltInGuard
@MustRunAfter(PathSafetyGuard.class)
@Component
public class OutputOverlapGuard implements Guard {

    public static final String ID = "G2";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Output Overlap";
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        Map<String, List<String>> rulesByPath = new TreeMap<>();
        for (GenerationRule rule : context.rules()) {
            String normalized = WorkspacePaths.normalize(rule.output());
            String key = normalized == null ? rule.output() : normalized;
            rulesByPath.computeIfAbsent(key, k -> new ArrayList<>()).add(rule.name());
        }
        List<String> conflicts = new ArrayList<>();
        rulesByPath.forEach((path, rules) -> {
            if (rules.size() > 1) {
                conflicts.add(path + " <- " + String.join(", ", rules));
            }
        });
        Map<String, Object> metadata = Map.of("outputs", rulesByPath.size(), "conflicts", conflicts.size());
        if (conflicts.isEmpty()) {
            return GuardOutcome.pass(rulesByPath.size() + " distinct output paths", metadata);
        }
        return GuardOutcome.fail(GuardViolation.OUTPUT_OVERLAP_CONFLICT,
                "Rules share output paths: " + String.join("; ", conflicts), metadata);
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return "Give every generation rule its own output path";
    }
}
