package com.github.salilvnair.proofgen.engine.tracker;

import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.InputDescriptor;
import com.github.salilvnair.proofgen.engine.workspace.InputKind;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * The hashes an artifact record is keyed on. The ontology hash covers every ontology of the workspace;
 * the template hash covers a rule's template together with its query.
 */
@RequiredArgsConstructor
@Component
public class ProvenanceHashes {

    private final ContentHasher hasher;

    public String ontologyHash(WorkspaceContext workspace) {
        return hasher.hash(String.join("\n", workspace.ontologyHashes()));
    }

    public String templateHash(WorkspaceContext workspace, GenerationRule rule) {
        return hasher.hash("template:" + contentHash(workspace, rule.template())
                + "\nquery:" + contentHash(workspace, rule.query()));
    }

    public List<String> dependencies(WorkspaceContext workspace, GenerationRule rule) {
        List<String> dependencies = new ArrayList<>();
        dependencies.add(rule.query());
        dependencies.add(rule.template());
        workspace.inputsOf(InputKind.ONTOLOGY).forEach(o -> dependencies.add(o.path()));
        return dependencies;
    }

    private static String contentHash(WorkspaceContext workspace, String path) {
        return workspace.descriptor(path).map(InputDescriptor::contentHash).orElse("");
    }
}
