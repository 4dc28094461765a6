package com.github.salilvnair.proofgen.engine.graph;

import lombok.Getter;
import org.apache.jena.rdf.model.Model;

import java.util.Map;

/**
 * Merged, read-only view of every ontology file of a run.
 */
@Getter
public class OntologyGraph {

    private final Model model;
    private final Map<String, Long> tripleCounts;

    public OntologyGraph(Model model, Map<String, Long> tripleCounts) {
        this.model = model;
        this.tripleCounts = Map.copyOf(tripleCounts);
    }

    public long tripleCount() {
        return model.size();
    }
}
