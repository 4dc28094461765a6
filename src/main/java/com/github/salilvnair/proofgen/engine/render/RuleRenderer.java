package com.github.salilvnair.proofgen.engine.render;

import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.graph.GraphLoader;
import com.github.salilvnair.proofgen.engine.graph.OntologyGraph;
import com.github.salilvnair.proofgen.engine.graph.SourceFile;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.query.PreparedQuery;
import com.github.salilvnair.proofgen.engine.query.QueryBindings;
import com.github.salilvnair.proofgen.engine.query.QueryExecutor;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.InputDescriptor;
import com.github.salilvnair.proofgen.engine.workspace.InputKind;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceContext;
import com.github.salilvnair.proofgen.template.CompiledTemplate;
import com.github.salilvnair.proofgen.template.TemplateRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Extraction and rendering of a single rule over the workspace snapshot.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class RuleRenderer {

    private final GraphLoader graphLoader;
    private final QueryExecutor queryExecutor;
    private final TemplateRenderer templateRenderer;
    private final ContentHasher hasher;

    public OntologyGraph loadGraph(WorkspaceContext workspace) {
        List<SourceFile> sources = workspace.inputsOf(InputKind.ONTOLOGY).stream()
                .map(InputDescriptor::path)
                .map(path -> new SourceFile(path, workspace.bytes(path)))
                .toList();
        return graphLoader.parse(sources);
    }

    public PreparedQuery prepare(WorkspaceContext workspace, String queryPath) {
        return queryExecutor.prepare(queryPath, require(workspace, queryPath));
    }

    public QueryBindings execute(OntologyGraph graph, PreparedQuery query) {
        return queryExecutor.execute(graph, query);
    }

    public CompiledTemplate compile(WorkspaceContext workspace, String templatePath) {
        return templateRenderer.compile(templatePath, require(workspace, templatePath));
    }

    public RenderedArtifact render(WorkspaceContext workspace, OntologyGraph graph, GenerationRule rule) {
        long start = System.nanoTime();
        PreparedQuery query = prepare(workspace, rule.query());
        QueryBindings bindings = execute(graph, query);
        long extracted = System.nanoTime();

        CompiledTemplate template = compile(workspace, rule.template());
        String content = templateRenderer.render(template, bindings);
        long rendered = System.nanoTime();

        log.debug("Rendered rule {} -> {} ({} rows)", rule.name(), rule.output(), bindings.size());
        return new RenderedArtifact(
                rule,
                content,
                hasher.hash(content),
                bindings.size(),
                (extracted - start) / 1_000_000,
                (rendered - extracted) / 1_000_000);
    }

    private String require(WorkspaceContext workspace, String path) {
        String text = workspace.text(path);
        if (text == null) {
            throw new ProofGenException(ProofGenErrorCode.INPUT_NOT_FOUND, "Input not loaded: " + path);
        }
        return text;
    }
}
