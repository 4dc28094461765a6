package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReceiptFile(
        @JsonProperty("path") String path,
        @JsonProperty("hash") String hash,
        @JsonProperty("size") long size
) {
}
