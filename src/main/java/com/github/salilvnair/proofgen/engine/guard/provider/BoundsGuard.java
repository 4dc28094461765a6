package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.render.RenderAttempt;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.GuardSettings;
import com.github.salilvnair.proofgen.engine.workspace.InputDescriptor;
import com.github.salilvnair.proofgen.engine.workspace.WorkspacePaths;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * G7: planned output count and rendered size stay within the configured limits, and no single input
 * exceeds its kind's size limit.
 */
@BuiltInGuard
@MustRunAfter(DeterminismGuard.class)
@Component
public class BoundsGuard implements Guard {

    public static final String ID = "G7";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Bounds";
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        GuardSettings limits = context.getWorkspace().getGuardSettings();
        List<String> exceeded = new ArrayList<>();

        for (InputDescriptor input : context.getWorkspace().getInputs()) {
            long limit = switch (input.kind()) {
                case ONTOLOGY -> limits.getMaxOntologyBytes();
                case TEMPLATE -> limits.getMaxTemplateBytes();
                case QUERY -> limits.getMaxQueryBytes();
                case CONFIG -> Long.MAX_VALUE;
            };
            if (input.sizeBytes() > limit) {
                exceeded.add(input.path() + " is " + input.sizeBytes() + " bytes (limit " + limit + ")");
            }
        }

        // one entry per normalized output; the last rule wins as it does when writing
        Map<String, GenerationRule> byOutput = new LinkedHashMap<>();
        for (GenerationRule rule : context.rules()) {
            String normalized = WorkspacePaths.normalize(rule.output());
            byOutput.put(normalized == null ? rule.output() : normalized, rule);
        }
        int planned = byOutput.size();
        if (planned > limits.getMaxOutputFiles()) {
            exceeded.add(planned + " planned outputs (limit " + limits.getMaxOutputFiles() + ")");
        }

        long total = 0;
        int unsized = 0;
        for (GenerationRule rule : byOutput.values()) {
            if (!context.getOptions().mayExecute()) {
                unsized++;
                continue;
            }
            RenderAttempt attempt = context.render(rule);
            if (!attempt.succeeded()) {
                unsized++;
                continue;
            }
            long size = attempt.artifact().sizeBytes();
            total += size;
            if (size > limits.getMaxFileBytes()) {
                exceeded.add(rule.output() + " is " + size + " bytes (limit " + limits.getMaxFileBytes() + ")");
            }
        }
        if (total > limits.getMaxOutputBytes()) {
            exceeded.add("total output " + total + " bytes (limit " + limits.getMaxOutputBytes() + ")");
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("planned_files", planned);
        metadata.put("total_bytes", total);
        metadata.put("unsized_rules", unsized);
        metadata.put("max_output_files", limits.getMaxOutputFiles());
        metadata.put("max_output_bytes", limits.getMaxOutputBytes());
        if (!exceeded.isEmpty()) {
            return GuardOutcome.fail(GuardViolation.BOUNDS_EXCEEDED, "Limits exceeded: " + String.join("; ", exceeded), metadata);
        }
        return GuardOutcome.pass(planned + " files, " + total + " bytes within limits", metadata);
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return "Split the generation or raise max_output_files / max_output_bytes in the [guards] section";
    }
}
