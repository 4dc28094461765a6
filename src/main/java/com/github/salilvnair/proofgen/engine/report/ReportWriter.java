package com.github.salilvnair.proofgen.engine.report;

import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.core.GuardVerdict;
import com.github.salilvnair.proofgen.engine.model.CompilationSummary;
import com.github.salilvnair.proofgen.engine.receipt.model.OutputStatus;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptOutput;
import com.github.salilvnair.proofgen.engine.workspace.InputDescriptor;
import com.github.salilvnair.proofgen.engine.workspace.InputKind;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceContext;
import com.github.salilvnair.proofgen.engine.writer.AtomicFileWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Human-readable markdown summary of a run, written next to the receipt.
 */
@RequiredArgsConstructor
@Component
public class ReportWriter {

    private final AtomicFileWriter writer;

    public String render(WorkspaceContext workspace, String timestamp, CompilationSummary summary) {
        StringBuilder out = new StringBuilder()
                .append("# ProofGen Sync Report\n")
                .append("**Workspace**: ").append(workspace.getFingerprint()).append('\n')
                .append("**Timestamp**: ").append(timestamp).append('\n')
                .append("**Mode**: ").append(summary.mode().value()).append('\n')
                .append("**Status**: ").append(summary.status()).append("\n\n");

        out.append("## Inputs Discovered\n");
        InputDescriptor config = workspace.getConfig();
        out.append("- Config: ").append(config == null ? "(none)" : config.path())
                .append(" (").append(workspace.getRules().size()).append(" rules)\n");
        for (InputDescriptor ontology : workspace.inputsOf(InputKind.ONTOLOGY)) {
            out.append("- Ontology: ").append(ontology.path())
                    .append(" (").append(ontology.sizeBytes() / 1024).append("KB)\n");
        }
        out.append("- Queries: ").append(workspace.inputsOf(InputKind.QUERY).size()).append(" files\n");
        out.append("- Templates: ").append(workspace.inputsOf(InputKind.TEMPLATE).size()).append(" files\n\n");

        out.append("## Guard Verdicts\n");
        for (GuardVerdict verdict : summary.guards()) {
            out.append("- [").append(verdict.status()).append("] ")
                    .append(verdict.guardId()).append(": ").append(verdict.guardName());
            if (verdict.diagnostic() != null) {
                out.append(" (").append(verdict.diagnostic()).append(')');
            }
            out.append('\n');
        }
        out.append('\n');

        out.append("## Changes\n");
        for (OutputStatus status : OutputStatus.values()) {
            long count = summary.outputs().stream().filter(o -> o.status() == status).count();
            out.append("- ").append(status.name().toLowerCase()).append(": ").append(count).append('\n');
        }
        for (ReceiptOutput output : summary.outputs()) {
            out.append("  - ").append(output.path()).append(" [").append(output.language()).append("] ")
                    .append(output.status()).append('\n');
        }
        if (!summary.orphanedFiles().isEmpty()) {
            out.append("- orphaned: ").append(String.join(", ", summary.orphanedFiles())).append('\n');
        }
        for (String skipped : summary.skippedRules()) {
            out.append("- not produced: ").append(skipped).append('\n');
        }
        out.append('\n');

        out.append("## Performance\n");
        for (Map.Entry<String, Long> stage : summary.performance().stages().entrySet()) {
            out.append("- ").append(stage.getKey()).append(": ").append(stage.getValue()).append("ms\n");
        }
        out.append("- cache hit rate: ")
                .append(Math.round(summary.performance().cacheHitRate() * 100)).append("%\n");
        out.append("- **Total**: ").append(summary.performance().totalDurationMs()).append("ms\n\n");

        out.append("## Receipts\n")
                .append("- Receipt: ").append(summary.receiptPath()).append('\n')
                .append("- Report: ").append(summary.reportPath()).append('\n')
                .append("- Diff: ").append(summary.diffPath()).append('\n');
        return out.toString();
    }

    public void write(Path target, String report) {
        try {
            writer.write(target, report.getBytes(StandardCharsets.UTF_8));
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.OUTPUT_WRITE_FAILED,
                    "Failed to write report " + target + ": " + e.getMessage(), e);
        }
    }
}
