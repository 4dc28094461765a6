package com.github.salilvnair.proofgen.engine.query;

import com.github.salilvnair.proofgen.engine.exception.QueryExecutionException;
import com.github.salilvnair.proofgen.engine.graph.OntologyGraph;
import lombok.extern.slf4j.Slf4j;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.QueryParseException;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.sparql.core.Var;
import org.apache.jena.sparql.syntax.PatternVars;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SPARQL SELECT over the in-memory ontology graph.
 * <p>
 * Rows of a query without {@code ORDER BY} are sorted on their rendered values so template input never
 * depends on store iteration order. Blank nodes render as {@value #BLANK_NODE}.
 */
@Slf4j
@Component
public class SparqlQueryExecutor implements QueryExecutor {

    static final String BLANK_NODE = "_:blank";

    @Override
    public PreparedQuery prepare(String name, String text) {
        Query query;
        try {
            query = QueryFactory.create(text);
        }
        catch (QueryParseException e) {
            throw new QueryExecutionException(name, e.getLine(), e.getColumn(), e.getMessage(), e);
        }
        if (!query.isSelectType()) {
            throw new QueryExecutionException(name, "only SELECT queries are supported", null);
        }
        List<String> unbound = unboundProjection(query);
        if (!unbound.isEmpty()) {
            throw new QueryExecutionException(name,
                    "projected variable(s) never bound in the pattern: " + String.join(", ", unbound), null);
        }
        return new PreparedQuery(name, query, query.hasOrderBy());
    }

    @Override
    public QueryBindings execute(OntologyGraph graph, PreparedQuery prepared) {
        List<Map<String, String>> rows = new ArrayList<>();
        List<String> variables;
        try (QueryExecution execution = QueryExecutionFactory.create(prepared.query(), graph.getModel())) {
            ResultSet results = execution.execSelect();
            variables = List.copyOf(results.getResultVars());
            while (results.hasNext()) {
                QuerySolution solution = results.next();
                Map<String, String> row = new LinkedHashMap<>();
                for (String variable : variables) {
                    RDFNode node = solution.get(variable);
                    if (node != null) {
                        row.put(variable, lexical(node));
                    }
                }
                rows.add(row);
            }
        }
        catch (RuntimeException e) {
            throw new QueryExecutionException(prepared.name(), e.getMessage(), e);
        }
        if (!prepared.ordered()) {
            rows.sort(rowOrder(variables));
        }
        log.debug("Query {} returned {} rows", prepared.name(), rows.size());
        return new QueryBindings(variables, rows);
    }

    private List<String> unboundProjection(Query query) {
        if (query.isQueryResultStar()) {
            return List.of();
        }
        Collection<Var> bound = PatternVars.vars(query.getQueryPattern());
        return query.getProjectVars().stream()
                .filter(v -> !query.getProject().hasExpr(v))
                .filter(v -> !bound.contains(v))
                .map(Var::getVarName)
                .collect(Collectors.toList());
    }

    static String lexical(RDFNode node) {
        if (node.isLiteral()) {
            return node.asLiteral().getLexicalForm();
        }
        if (node.isURIResource()) {
            return node.asResource().getURI();
        }
        return BLANK_NODE;
    }

    private static Comparator<Map<String, String>> rowOrder(List<String> variables) {
        return (a, b) -> {
            for (String variable : variables) {
                int cmp = Comparator.<String>nullsFirst(Comparator.naturalOrder())
                        .compare(a.get(variable), b.get(variable));
                if (cmp != 0) {
                    return cmp;
                }
            }
            return 0;
        };
    }
}
