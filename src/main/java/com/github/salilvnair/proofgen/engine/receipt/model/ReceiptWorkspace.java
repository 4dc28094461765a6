package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReceiptWorkspace(
        @JsonProperty("root") String root,
        @JsonProperty("fingerprint") String fingerprint
) {
}
