package com.github.salilvnair.proofgen.engine.query;

import java.util.List;
import java.util.Map;

public record QueryBindings(List<String> variables, List<Map<String, String>> rows) {

    public QueryBindings {
        variables = List.copyOf(variables);
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }
}
