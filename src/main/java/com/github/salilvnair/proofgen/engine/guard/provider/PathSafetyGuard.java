package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.WorkspacePaths;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * G1: every path a run reads or writes, declared ontologies included, must stay inside the workspace root.
 */
@BuiltInGuard
@Component
public class PathSafetyGuard implements Guard {

    public static final String ID = "G1";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Path Safety";
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        Path root = context.getWorkspace().getRoot();
        List<String> violations = new ArrayList<>();
        int checked = 0;
        for (GenerationRule rule : context.rules()) {
            for (String path : List.of(rule.output(), rule.query(), rule.template())) {
                checked++;
                String reason = violation(root, path);
                if (reason != null) {
                    violations.add(path + " (rule " + rule.name() + "): " + reason);
                }
            }
        }
        for (String ontology : context.getWorkspace().getDeclaredOntologies()) {
            checked++;
            String reason = violation(root, ontology);
            if (reason != null) {
                violations.add(ontology + " (ontology): " + reason);
            }
        }
        Map<String, Object> metadata = Map.of("paths_checked", checked, "violations", violations.size());
        if (violations.isEmpty()) {
            return GuardOutcome.pass("All " + checked + " paths are inside the workspace root", metadata);
        }
        return GuardOutcome.fail(GuardViolation.PATH_SAFETY_VIOLATION,
                "Unsafe paths: " + String.join("; ", violations), metadata);
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return "Use relative paths without '..' segments that resolve inside the workspace root";
    }

    static String violation(Path root, String path) {
        if (path == null || path.isBlank()) {
            return "empty path";
        }
        if (WorkspacePaths.isAbsolute(path)) {
            return "absolute path";
        }
        if (WorkspacePaths.hasParentSegment(path)) {
            return "parent-directory segment";
        }
        if (WorkspacePaths.escapesRoot(root, path)) {
            return "resolves outside the workspace root";
        }
        return null;
    }
}
