package com.github.salilvnair.proofgen.engine.query;

import org.apache.jena.query.Query;

/**
 * A parsed extraction query. {@code ordered} is true when the query fixes its own row order.
 */
public record PreparedQuery(String name, Query query, boolean ordered) {
}
