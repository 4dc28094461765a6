package com.github.salilvnair.proofgen.engine.guard.core;

import com.github.salilvnair.proofgen.engine.exception.GraphParseException;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.graph.OntologyGraph;
import com.github.salilvnair.proofgen.engine.render.RenderAttempt;
import com.github.salilvnair.proofgen.engine.render.RuleRenderer;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceContext;
import lombok.Getter;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Everything a guard may look at: the workspace snapshot, the planned outputs, the run options and
 * memoized extraction results. Shared by guards running in parallel; the graph and renders are computed
 * at most once.
 */
public class GuardContext {

    @Getter
    private final WorkspaceContext workspace;
    @Getter
    private final GuardOptions options;
    @Getter
    private final RuleRenderer renderer;

    private final Object graphLock = new Object();
    private volatile boolean graphLoaded;
    private OntologyGraph graph;
    private GraphParseException graphFailure;

    private final Map<String, RenderAttempt> renders = new ConcurrentHashMap<>();

    public GuardContext(WorkspaceContext workspace, GuardOptions options, RuleRenderer renderer) {
        this.workspace = workspace;
        this.options = options;
        this.renderer = renderer;
    }

    public List<String> plannedOutputs() {
        return workspace.plannedOutputs();
    }

    public List<GenerationRule> rules() {
        return workspace.getRules();
    }

    public OntologyGraph graph() {
        ensureGraph();
        if (graphFailure != null) {
            throw graphFailure;
        }
        return graph;
    }

    public Optional<GraphParseException> graphFailure() {
        ensureGraph();
        return Optional.ofNullable(graphFailure);
    }

    /** Render once per rule and remember the outcome. */
    public RenderAttempt render(GenerationRule rule) {
        return renders.computeIfAbsent(rule.name() + "\u0000" + rule.output(), k -> renderFresh(rule));
    }

    /** Render without consulting or filling the memo. */
    public RenderAttempt renderFresh(GenerationRule rule) {
        try {
            return RenderAttempt.success(renderer.render(workspace, graph(), rule));
        }
        catch (ProofGenException e) {
            return RenderAttempt.failed(rule, e);
        }
    }

    private void ensureGraph() {
        if (graphLoaded) {
            return;
        }
        synchronized (graphLock) {
            if (graphLoaded) {
                return;
            }
            try {
                graph = renderer.loadGraph(workspace);
            }
            catch (GraphParseException e) {
                graphFailure = e;
            }
            graphLoaded = true;
        }
    }
}
