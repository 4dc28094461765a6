package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReceiptOutput(
        @JsonProperty("path") String path,
        @JsonProperty("hash") String hash,
        @JsonProperty("size") long size,
        @JsonProperty("status") OutputStatus status,
        @JsonProperty("language") String language
) {

    public boolean materialized() {
        return status != OutputStatus.PREVIEW;
    }
}
