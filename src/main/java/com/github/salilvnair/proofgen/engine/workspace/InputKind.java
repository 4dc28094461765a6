package com.github.salilvnair.proofgen.engine.workspace;

public enum InputKind {
    CONFIG,
    ONTOLOGY,
    QUERY,
    TEMPLATE
}
