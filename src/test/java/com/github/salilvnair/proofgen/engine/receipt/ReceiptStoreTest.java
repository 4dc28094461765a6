package com.github.salilvnair.proofgen.engine.receipt;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.exception.ReceiptIntegrityException;
import com.github.salilvnair.proofgen.engine.guard.core.GuardEvaluation;
import com.github.salilvnair.proofgen.engine.receipt.model.GenerationReceipt;
import com.github.salilvnair.proofgen.engine.receipt.model.OutputStatus;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptArtifacts;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptOutput;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptPerformance;
import com.github.salilvnair.proofgen.engine.receipt.model.SyncMode;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceContext;
import com.github.salilvnair.proofgen.support.ProofGenTestContext;
import com.github.salilvnair.proofgen.support.TestWorkspaces;
import com.github.salilvnair.proofgen.util.JsonUtil;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReceiptStoreTest {

    @TempDir
    Path root;

    private final ProofGenTestContext ctx = new ProofGenTestContext();

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void saveWritesPrettyJsonNamedAfterReceiptId() throws Exception {
        GenerationReceipt receipt = receipt();

        Path saved = ctx.receiptStore.save(root, receipt);

        assertEquals(root.toAbsolutePath().normalize().resolve(".ggen/receipts/" + receipt.receiptId() + ".json"), saved);
        String json = Files.readString(saved);
        assertTrue(json.contains("\n"));
        assertTrue(json.contains("\"receipt_id\""));
        assertTrue(json.contains("\"compiler_version\""));
    }

    @Test
    void loadedReceiptKeepsItsId() {
        GenerationReceipt receipt = receipt();
        Path saved = ctx.receiptStore.save(root, receipt);

        GenerationReceipt loaded = ctx.receiptStore.loadVerified(saved);

        assertEquals(receipt.receiptId(), loaded.receiptId());
        assertEquals(SyncMode.APPLY, loaded.mode());
        assertEquals(receipt.outputs(), loaded.outputs());
        assertEquals(JsonUtil.toCanonicalJson(receipt), JsonUtil.toCanonicalJson(loaded));
    }

    @Test
    void loadIgnoresUnknownFields() throws Exception {
        Path saved = ctx.receiptStore.save(root, receipt());
        ObjectNode node = (ObjectNode) JsonUtil.mapper().readTree(saved.toFile());
        node.put("x_extension", "ignored");
        Files.writeString(saved, JsonUtil.toJson(node));

        GenerationReceipt loaded = ctx.receiptStore.load(saved);

        assertEquals(receipt().receiptId(), loaded.receiptId());
    }

    @Test
    void editedReceiptFailsIntegrityCheck() throws Exception {
        Path saved = ctx.receiptStore.save(root, receipt());
        ObjectNode node = (ObjectNode) JsonUtil.mapper().readTree(saved.toFile());
        node.put("compiler_version", "9.9.9");
        Files.writeString(saved, JsonUtil.toJson(node));

        ReceiptIntegrityException ex = assertThrows(ReceiptIntegrityException.class,
                () -> ctx.receiptStore.loadVerified(saved));

        assertEquals(ProofGenErrorCode.RECEIPT_INTEGRITY_FAILED.name(), ex.getErrorCode());
        assertEquals(receipt().receiptId(), ex.getRecordedId());
    }

    @Test
    void unreadableReceiptIsReported() {
        Path garbage = TestWorkspaces.write(root, "bad.json", "{ not json");
        Path empty = TestWorkspaces.write(root, "null.json", "null");

        assertEquals(ProofGenErrorCode.RECEIPT_READ_FAILED.name(),
                assertThrows(ProofGenException.class, () -> ctx.receiptStore.load(garbage)).getErrorCode());
        assertEquals(ProofGenErrorCode.RECEIPT_READ_FAILED.name(),
                assertThrows(ProofGenException.class, () -> ctx.receiptStore.load(empty)).getErrorCode());
        assertEquals(ProofGenErrorCode.RECEIPT_READ_FAILED.name(),
                assertThrows(ProofGenException.class, () -> ctx.receiptStore.load(root.resolve("missing.json"))).getErrorCode());
    }

    private GenerationReceipt receipt() {
        WorkspaceContext workspace = ctx.discovery.discover(TestWorkspaces.standard(root));
        GuardEvaluation evaluation = ctx.kernel.evaluate(
                ctx.guardContext(workspace, ProofGenTestContext.defaultOptions()), "run-1");
        return ctx.receiptGenerator.generate(
                workspace,
                evaluation,
                List.of(new ReceiptOutput("out/a.rs", "h", 3, OutputStatus.CREATED, "rust")),
                new ReceiptPerformance(5, 0.0, Map.of("guards", 2L)),
                SyncMode.APPLY,
                new ReceiptArtifacts(".ggen/reports/r.md", ".ggen/diffs/r.diff"));
    }
}
