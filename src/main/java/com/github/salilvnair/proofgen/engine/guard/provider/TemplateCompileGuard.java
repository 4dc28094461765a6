package com.github.salilvnair.proofgen.engine.guard.provider;

import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.annotation.BuiltInGuard;
import com.github.salilvnair.proofgen.engine.guard.annotation.MustRunAfter;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardViolation;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * G3: every referenced template compiles.
 */
@BuiltInGuard
@MustRunAfter(OutputOverlapGuard.class)
@Component
public class TemplateCompileGuard implements Guard {

    public static final String ID = "G3";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Template Compilation";
    }

    @Override
    public GuardOutcome check(GuardContext context) {
        TreeSet<String> templates = new TreeSet<>();
        for (GenerationRule rule : context.rules()) {
            templates.add(rule.template());
        }
        List<String> errors = new ArrayList<>();
        for (String template : templates) {
            if (!context.getWorkspace().isLoaded(template)) {
                errors.add(template + ": not loaded");
                continue;
            }
            try {
                context.getRenderer().compile(context.getWorkspace(), template);
            }
            catch (ProofGenException e) {
                errors.add(e.getMessage());
            }
        }
        Map<String, Object> metadata = Map.of("templates", templates.size(), "errors", errors.size());
        if (errors.isEmpty()) {
            return GuardOutcome.pass(templates.size() + " templates compiled", metadata);
        }
        return GuardOutcome.fail(GuardViolation.TEMPLATE_COMPILE_ERROR, String.join("; ", errors), metadata);
    }

    @Override
    public String remediation(GuardOutcome outcome) {
        return "Fix the template syntax at the reported line and column";
    }
}
