package com.github.salilvnair.proofgen.engine.query;

import com.github.salilvnair.proofgen.engine.exception.QueryExecutionException;
import com.github.salilvnair.proofgen.engine.graph.OntologyGraph;

public interface QueryExecutor {

    PreparedQuery prepare(String name, String text) throws QueryExecutionException;

    QueryBindings execute(OntologyGraph graph, PreparedQuery query) throws QueryExecutionException;
}
