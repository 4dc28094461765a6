package com.github.salilvnair.proofgen.engine.receipt;

import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.engine.guard.core.GuardEvaluation;
import com.github.salilvnair.proofgen.engine.hash.ContentHasher;
import com.github.salilvnair.proofgen.engine.receipt.model.GenerationReceipt;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptArtifacts;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptFile;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptGuard;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptInputs;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptOutput;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptPerformance;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptWorkspace;
import com.github.salilvnair.proofgen.engine.receipt.model.SyncMode;
import com.github.salilvnair.proofgen.engine.workspace.InputDescriptor;
import com.github.salilvnair.proofgen.engine.workspace.InputKind;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Assembles the receipt of a run. The id is computed once every other field is final, the optional
 * signature after that. Given the same inputs and clock the receipt is byte-identical.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ReceiptGenerator {

    private final ProofGenConfig config;
    private final ContentHasher hasher;
    private final ReceiptSigner signer;
    private final Clock clock;

    public GenerationReceipt generate(WorkspaceContext workspace,
                                      GuardEvaluation evaluation,
                                      List<ReceiptOutput> outputs,
                                      ReceiptPerformance performance,
                                      SyncMode mode,
                                      ReceiptArtifacts artifacts) {
        GenerationReceipt receipt = new GenerationReceipt(
                GenerationReceipt.SCHEMA_VERSION,
                Instant.now(clock).truncatedTo(ChronoUnit.MILLIS).toString(),
                config.getCompilerVersion(),
                mode,
                new ReceiptWorkspace(workspace.getRoot().toString(), workspace.getFingerprint()),
                inputs(workspace),
                evaluation.verdicts().stream().map(ReceiptGuard::of).toList(),
                outputs.stream().sorted(Comparator.comparing(ReceiptOutput::path)).toList(),
                performance,
                artifacts,
                null,
                null);

        String receiptId = ReceiptIds.compute(hasher, receipt);
        receipt = receipt.withReceiptId(receiptId);
        String signature = signer.sign(receiptId);
        if (signature != null) {
            receipt = receipt.withSignature(signature);
        }
        log.debug("Generated receipt {} ({} outputs, signed={})", receiptId, outputs.size(), receipt.signed());
        return receipt;
    }

    private ReceiptInputs inputs(WorkspaceContext workspace) {
        InputDescriptor config = workspace.getConfig();
        return new ReceiptInputs(
                config == null ? null : file(config),
                files(workspace, InputKind.ONTOLOGY),
                files(workspace, InputKind.QUERY),
                files(workspace, InputKind.TEMPLATE));
    }

    private List<ReceiptFile> files(WorkspaceContext workspace, InputKind kind) {
        return workspace.inputsOf(kind).stream().map(ReceiptGenerator::file).toList();
    }

    private static ReceiptFile file(InputDescriptor descriptor) {
        return new ReceiptFile(descriptor.path(), descriptor.contentHash(), descriptor.sizeBytes());
    }
}
