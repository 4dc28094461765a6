package com.github.salilvnair.proofgen.engine.tracker;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Provenance of one generated file as persisted in the tracker state file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArtifactRecord(
        @JsonProperty("ontology_hash") String ontologyHash,
        @JsonProperty("template_hash") String templateHash,
        @JsonProperty("artifact_hash") String artifactHash,
        @JsonProperty("dependencies") List<String> dependencies,
        @JsonProperty("recorded_at") String recordedAt
) {

    public ArtifactRecord {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
