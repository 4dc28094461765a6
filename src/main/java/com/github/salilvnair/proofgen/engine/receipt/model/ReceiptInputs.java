package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReceiptInputs(
        @JsonProperty("config") ReceiptFile config,
        @JsonProperty("ontologies") List<ReceiptFile> ontologies,
        @JsonProperty("queries") List<ReceiptFile> queries,
        @JsonProperty("templates") List<ReceiptFile> templates
) {

    public ReceiptInputs {
        ontologies = ontologies == null ? List.of() : List.copyOf(ontologies);
        queries = queries == null ? List.of() : List.copyOf(queries);
        templates = templates == null ? List.of() : List.copyOf(templates);
    }

    public List<ReceiptFile> all() {
        List<ReceiptFile> all = new ArrayList<>();
        if (config != null) {
            all.add(config);
        }
        all.addAll(ontologies);
        all.addAll(queries);
        all.addAll(templates);
        return all;
    }
}
