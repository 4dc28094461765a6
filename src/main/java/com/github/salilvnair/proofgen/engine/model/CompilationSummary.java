package com.github.salilvnair.proofgen.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.salilvnair.proofgen.engine.guard.core.GuardVerdict;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptOutput;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptPerformance;
import com.github.salilvnair.proofgen.engine.receipt.model.SyncMode;
import lombok.Builder;

import java.util.List;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompilationSummary(
        @JsonProperty("run_id") String runId,
        @JsonProperty("receipt_id") String receiptId,
        @JsonProperty("mode") SyncMode mode,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("guards") List<GuardVerdict> guards,
        @JsonProperty("outputs") List<ReceiptOutput> outputs,
        @JsonProperty("orphaned_files") List<String> orphanedFiles,
        @JsonProperty("skipped_rules") List<String> skippedRules,
        @JsonProperty("receipt_path") String receiptPath,
        @JsonProperty("report_path") String reportPath,
        @JsonProperty("diff_path") String diffPath,
        @JsonProperty("performance") ReceiptPerformance performance
) {

    public CompilationSummary {
        guards = guards == null ? List.of() : List.copyOf(guards);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        orphanedFiles = orphanedFiles == null ? List.of() : List.copyOf(orphanedFiles);
        skippedRules = skippedRules == null ? List.of() : List.copyOf(skippedRules);
    }
}
