package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReceiptArtifacts(
        @JsonProperty("report") String report,
        @JsonProperty("diff") String diff
) {
}
