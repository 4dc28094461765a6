package com.github.salilvnair.proofgen.engine.receipt.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Write-once provenance record of a generation run. {@code receiptId} digests every other field except
 * {@code signature}, which is computed over the id afterwards.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerationReceipt(
        @JsonProperty("version") String version,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("compiler_version") String compilerVersion,
        @JsonProperty("mode") SyncMode mode,
        @JsonProperty("workspace") ReceiptWorkspace workspace,
        @JsonProperty("inputs") ReceiptInputs inputs,
        @JsonProperty("guards") List<ReceiptGuard> guards,
        @JsonProperty("outputs") List<ReceiptOutput> outputs,
        @JsonProperty("performance") ReceiptPerformance performance,
        @JsonProperty("artifacts") ReceiptArtifacts artifacts,
        @JsonProperty("receipt_id") String receiptId,
        @JsonProperty("signature") String signature
) {

    public static final String SCHEMA_VERSION = "1.0.0";

    // missing sections stay null for the schema check; null entries are rejected
    public GenerationReceipt {
        guards = guards == null ? null : List.copyOf(guards);
        outputs = outputs == null ? null : List.copyOf(outputs);
    }

    public GenerationReceipt withReceiptId(String id) {
        return new GenerationReceipt(version, timestamp, compilerVersion, mode, workspace, inputs, guards,
                outputs, performance, artifacts, id, signature);
    }

    public GenerationReceipt withSignature(String value) {
        return new GenerationReceipt(version, timestamp, compilerVersion, mode, workspace, inputs, guards,
                outputs, performance, artifacts, receiptId, value);
    }

    public boolean signed() {
        return signature != null && !signature.isBlank();
    }
}
