package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.salilvnair.proofgen.engine.guard.core.GuardStatus;
import com.github.salilvnair.proofgen.engine.guard.core.GuardVerdict;

import java.util.Map;
import java.util.TreeMap;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReceiptGuard(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("verdict") GuardStatus verdict,
        @JsonProperty("diagnostic") String diagnostic,
        @JsonProperty("remediation") String remediation,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public ReceiptGuard {
        metadata = metadata == null ? Map.of() : new TreeMap<>(metadata);
    }

    public static ReceiptGuard of(GuardVerdict verdict) {
        return new ReceiptGuard(
                verdict.guardId(),
                verdict.guardName(),
                verdict.status(),
                verdict.diagnostic(),
                verdict.remediation(),
                verdict.metadata());
    }
}
