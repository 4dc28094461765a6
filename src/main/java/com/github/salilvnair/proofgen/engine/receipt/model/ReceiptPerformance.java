package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.TreeMap;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReceiptPerformance(
        @JsonProperty("total_duration_ms") long totalDurationMs,
        @JsonProperty("cache_hit_rate") double cacheHitRate,
        @JsonProperty("stages") Map<String, Long> stages
) {

    public ReceiptPerformance {
        stages = stages == null ? Map.of() : new TreeMap<>(stages);
    }
}
