package com.github.salilvnair.proofgen.engine.graph;

import com.github.salilvnair.proofgen.engine.exception.GraphParseException;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.support.TestWorkspaces;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JenaGraphLoaderTest {

    private final JenaGraphLoader loader = new JenaGraphLoader();

    @Test
    void parsesTurtleAndCountsTriplesPerFile() {
        OntologyGraph graph = loader.parse(List.of(source("ontology/domain.ttl", TestWorkspaces.ONTOLOGY)));

        assertEquals(10, graph.tripleCount());
        assertEquals(10L, graph.getTripleCounts().get("ontology/domain.ttl"));
    }

    @Test
    void mergesSeveralFiles() {
        String extra = """
                @prefix ex: <http://example.org/> .
                ex:Shipment ex:ships ex:Order .
                """;

        OntologyGraph graph = loader.parse(List.of(
                source("ontology/domain.ttl", TestWorkspaces.ONTOLOGY),
                source("ontology/extra.ttl", extra)));

        assertEquals(11, graph.tripleCount());
    }

    @Test
    void reportsFileAndLineOfSyntaxError() {
        GraphParseException ex = assertThrows(GraphParseException.class,
                () -> loader.parse(List.of(source("ontology/broken.ttl", TestWorkspaces.BROKEN_TURTLE))));

        assertEquals(ProofGenErrorCode.GRAPH_PARSE_FAILED.name(), ex.getErrorCode());
        assertEquals("ontology/broken.ttl", ex.getSource());
        assertTrue(ex.hasLocation());
        assertTrue(ex.getMessage().startsWith("ontology/broken.ttl:" + ex.getLine()));
    }

    private static SourceFile source(String path, String content) {
        return new SourceFile(path, content.getBytes(StandardCharsets.UTF_8));
    }
}
