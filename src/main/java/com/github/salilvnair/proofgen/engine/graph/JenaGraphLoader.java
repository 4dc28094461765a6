package com.github.salilvnair.proofgen.engine.graph;

import com.github.salilvnair.proofgen.engine.exception.GraphParseException;
import lombok.extern.slf4j.Slf4j;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFParser;
import org.apache.jena.riot.RiotException;
import org.apache.jena.riot.RiotParseException;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses Turtle ontology files with Jena RIOT into one in-memory model.
 */
@Slf4j
@Component
public class JenaGraphLoader implements GraphLoader {

    private static final Pattern RIOT_POSITION = Pattern.compile("\\[line: (\\d+), col: (\\d+)\\s*]");
    private static final String BASE_IRI = "http://proofgen.local/";

    @Override
    public OntologyGraph parse(List<SourceFile> sources) {
        Model merged = ModelFactory.createDefaultModel();
        Map<String, Long> tripleCounts = new LinkedHashMap<>();
        for (SourceFile source : sources) {
            Model model = ModelFactory.createDefaultModel();
            try {
                RDFParser.create()
                        .source(new ByteArrayInputStream(source.content()))
                        .lang(Lang.TURTLE)
                        .base(BASE_IRI + source.path())
                        .parse(model.getGraph());
            }
            catch (RiotParseException e) {
                throw new GraphParseException(source.path(), e.getLine(), e.getCol(), e.getOriginalMessage(), e);
            }
            catch (RiotException e) {
                throw located(source.path(), e);
            }
            tripleCounts.put(source.path(), model.size());
            merged.add(model);
        }
        log.debug("Loaded {} triples from {} ontology files", merged.size(), sources.size());
        return new OntologyGraph(merged, tripleCounts);
    }

    private GraphParseException located(String path, RiotException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        Matcher matcher = RIOT_POSITION.matcher(message);
        if (matcher.find()) {
            String detail = message.substring(matcher.end()).trim();
            return new GraphParseException(path,
                    Long.parseLong(matcher.group(1)),
                    Long.parseLong(matcher.group(2)),
                    detail.isEmpty() ? message : detail,
                    e);
        }
        return new GraphParseException(path, message, e);
    }
}
