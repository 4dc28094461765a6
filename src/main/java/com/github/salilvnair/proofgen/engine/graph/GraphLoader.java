package com.github.salilvnair.proofgen.engine.graph;

import com.github.salilvnair.proofgen.engine.exception.GraphParseException;

import java.util.List;

public interface GraphLoader {
    OntologyGraph parse(List<SourceFile> sources) throws GraphParseException;
}
