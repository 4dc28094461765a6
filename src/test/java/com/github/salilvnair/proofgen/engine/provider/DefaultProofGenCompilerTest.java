package com.github.salilvnair.proofgen.engine.provider;

import com.github.salilvnair.proofgen.audit.ProofGenAuditStage;
import com.github.salilvnair.proofgen.engine.exception.GuardFailureException;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.core.GuardStatus;
import com.github.salilvnair.proofgen.engine.model.CompilationSummary;
import com.github.salilvnair.proofgen.engine.model.GenerateCommand;
import com.github.salilvnair.proofgen.engine.model.RunStatus;
import com.github.salilvnair.proofgen.engine.receipt.model.OutputStatus;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptOutput;
import com.github.salilvnair.proofgen.engine.receipt.model.SyncMode;
import com.github.salilvnair.proofgen.engine.receipt.verify.CheckStatus;
import com.github.salilvnair.proofgen.engine.receipt.verify.VerificationResult;
import com.github.salilvnair.proofgen.engine.tracker.ArtifactTracker;
import com.github.salilvnair.proofgen.support.ProofGenTestContext;
import com.github.salilvnair.proofgen.support.TestWorkspaces;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.github.salilvnair.proofgen.support.TestWorkspaces.rule;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultProofGenCompilerTest {

    private static final String BROKEN_RUST_TEMPLATE = """
            [# th:each="row : ${rows}"]
            pub struct [(${row['name']})] {
            [/]
            """;

    @TempDir
    Path root;

    private final ProofGenTestContext ctx = new ProofGenTestContext();

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    @Test
    void previewLeavesOutputsUntouchedButWritesReceiptReportAndDiff() {
        TestWorkspaces.standard(root);

        CompilationSummary summary = ctx.compiler.generate(GenerateCommand.builder().workspaceRoot(root).build());

        assertEquals(SyncMode.PREVIEW, summary.mode());
        assertEquals(RunStatus.COMPLETED, summary.status());
        assertFalse(Files.exists(root.resolve("out/a.rs")));
        assertFalse(Files.exists(root.resolve(".ggen/artifacts.json")));
        assertEquals(List.of(OutputStatus.PREVIEW), statuses(summary));
        assertTrue(Files.isRegularFile(Path.of(summary.receiptPath())));
        assertTrue(Path.of(summary.receiptPath()).isAbsolute());
        assertTrue(readString(Path.of(summary.reportPath())).startsWith("# ProofGen Sync Report"));
        String diff = readString(Path.of(summary.diffPath()));
        assertTrue(diff.contains("--- /dev/null\n+++ b/out/a.rs\n"));
        assertTrue(diff.contains("+pub struct Cart;"));
    }

    @Test
    void applyWritesOutputsAndTracksThem() {
        TestWorkspaces.standard(root);

        CompilationSummary summary = apply();

        assertEquals(List.of(OutputStatus.CREATED), statuses(summary));
        String generated = TestWorkspaces.read(root, "out/a.rs");
        assertTrue(generated.contains("pub struct Cart;"));
        assertTrue(generated.indexOf("Cart") < generated.indexOf("User"));
        ReceiptOutput output = summary.outputs().get(0);
        assertEquals(ctx.hasher.hash(generated), output.hash());
        assertEquals("rust", output.language());
        ArtifactTracker tracker = ctx.trackerFactory.load(root);
        assertNotNull(tracker.getRecord(Path.of("out/a.rs")));
        assertEquals(List.of("queries/a.rq", "templates/a.rs.tera", "ontology/domain.ttl"),
                tracker.getRecord(Path.of("out/a.rs")).dependencies());
        assertTrue(ctx.audit.stages().contains(ProofGenAuditStage.ARTIFACT_WRITTEN.value()));
        assertTrue(ctx.audit.stages().contains(ProofGenAuditStage.RUN_COMPLETE.value()));
    }

    @Test
    void secondApplyIsServedFromTheTracker() {
        TestWorkspaces.standard(root);
        apply();

        CompilationSummary second = apply();

        assertEquals(List.of(OutputStatus.UNCHANGED), statuses(second));
        assertEquals(1.0, second.performance().cacheHitRate());
        assertTrue(readString(Path.of(second.diffPath())).contains("# 0 files changed"));
    }

    @Test
    void templateChangeRegeneratesAsUpdated() {
        TestWorkspaces.standard(root);
        apply();
        TestWorkspaces.write(root, "templates/a.rs.tera", TestWorkspaces.TEMPLATE.replace("pub struct", "struct"));

        CompilationSummary summary = apply();

        assertEquals(List.of(OutputStatus.UPDATED), statuses(summary));
        assertEquals(0.0, summary.performance().cacheHitRate());
        assertFalse(TestWorkspaces.read(root, "out/a.rs").contains("pub struct"));
    }

    @Test
    void forceIgnoresTheCache() {
        TestWorkspaces.standard(root);
        apply();

        CompilationSummary forced = ctx.compiler.generate(GenerateCommand.builder()
                .workspaceRoot(root)
                .preview(false)
                .force(true)
                .build());

        assertEquals(List.of(OutputStatus.UNCHANGED), statuses(forced));
        assertEquals(0.0, forced.performance().cacheHitRate());
    }

    @Test
    void guardFailureBlocksTheRun() {
        TestWorkspaces.withRules(root, rule("escape", "queries/a.rq", "templates/a.rs.tera", "../escape.rs"));

        GuardFailureException ex = assertThrows(GuardFailureException.class, () -> apply());

        assertEquals("G1", ex.getFailedGuardId());
        assertEquals(7, ex.getVerdicts().size());
        assertEquals(GuardStatus.SKIP, ex.getVerdicts().get(6).status());
        assertFalse(Files.exists(root.resolve(".ggen/receipts")));
        assertTrue(ctx.audit.stages().contains(ProofGenAuditStage.RUN_BLOCKED.value()));
        assertFalse(ctx.audit.stages().contains(ProofGenAuditStage.RUN_FAILED.value()));
    }

    @Test
    void forcedUnsafeOutputIsSkippedButReceiptIsWritten() {
        TestWorkspaces.withRules(root,
                rule("escape", "queries/a.rq", "templates/a.rs.tera", "../escape.rs")
                        + rule("main", "queries/a.rq", "templates/a.rs.tera", "out/a.rs"));

        CompilationSummary summary = ctx.compiler.generate(
                GenerateCommand.builder().workspaceRoot(root).preview(false).force(true).build());

        assertEquals(RunStatus.FORCED, summary.status());
        assertFalse(Files.exists(root.getParent().resolve("escape.rs")));
        assertTrue(Files.exists(root.resolve("out/a.rs")));
        assertEquals(List.of("out/a.rs"), summary.outputs().stream().map(ReceiptOutput::path).toList());
        assertEquals(1, summary.skippedRules().size());
        assertTrue(summary.skippedRules().get(0).startsWith("escape:"));
        assertTrue(ctx.audit.stages().contains(ProofGenAuditStage.ARTIFACT_SKIPPED.value()));
        assertFalse(ctx.audit.stages().contains(ProofGenAuditStage.RUN_FAILED.value()));

        VerificationResult result = ctx.compiler.verify(Path.of(summary.receiptPath()));
        assertEquals(CheckStatus.FAIL, result.check("V5").orElseThrow().status());
    }

    @Test
    void forcedTemplateCompileFailureStillWritesReceipt() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "templates/a.rs.tera", "[# th:each=\"row : ${rows}\"]\npub struct X;\n");

        CompilationSummary summary = ctx.compiler.generate(
                GenerateCommand.builder().workspaceRoot(root).preview(false).force(true).build());

        assertEquals(RunStatus.FORCED, summary.status());
        assertEquals(GuardStatus.FAIL, verdict(summary, "G3"));
        assertTrue(Files.isRegularFile(Path.of(summary.receiptPath())));
        assertFalse(Files.exists(root.resolve("out/a.rs")));
        assertTrue(summary.outputs().isEmpty());
        assertEquals(1, summary.skippedRules().size());
        assertTrue(readString(Path.of(summary.reportPath())).contains("- not produced: "));

        VerificationResult result = ctx.compiler.verify(Path.of(summary.receiptPath()));
        assertEquals(CheckStatus.FAIL, result.check("V5").orElseThrow().status());
    }

    @Test
    void forcedGraphParseFailureStillWritesReceipt() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "ontology/domain.ttl", TestWorkspaces.BROKEN_TURTLE);

        CompilationSummary summary = ctx.compiler.generate(
                GenerateCommand.builder().workspaceRoot(root).preview(false).force(true).build());

        assertEquals(RunStatus.FORCED, summary.status());
        assertEquals(GuardStatus.FAIL, verdict(summary, "G4"));
        assertTrue(Files.isRegularFile(Path.of(summary.receiptPath())));
        assertFalse(Files.exists(root.resolve("out/a.rs")));
        assertEquals(1, summary.skippedRules().size());

        VerificationResult result = ctx.compiler.verify(Path.of(summary.receiptPath()));
        assertFalse(result.verified());
        assertEquals(CheckStatus.FAIL, result.check("V5").orElseThrow().status());
    }

    @Test
    void forcedOverlapKeepsTheLastRule() {
        TestWorkspaces.write(root, "templates/b.rs.tera", "// second\n");
        TestWorkspaces.withRules(root,
                rule("one", "queries/a.rq", "templates/a.rs.tera", "out/a.rs")
                        + rule("two", "queries/a.rq", "templates/b.rs.tera", "out/a.rs"));

        CompilationSummary summary = ctx.compiler.generate(
                GenerateCommand.builder().workspaceRoot(root).preview(false).force(true).build());

        assertEquals(RunStatus.FORCED, summary.status());
        assertEquals(1, summary.outputs().size());
        assertEquals("// second\n", TestWorkspaces.read(root, "out/a.rs"));
    }

    @Test
    void validateOnlyStopsAfterGuards() {
        TestWorkspaces.standard(root);

        CompilationSummary summary = ctx.compiler.generate(
                GenerateCommand.builder().workspaceRoot(root).validateOnly(true).build());

        assertEquals(RunStatus.VALIDATED, summary.status());
        assertNull(summary.receiptId());
        assertEquals(7, summary.guards().size());
        assertFalse(Files.exists(root.resolve(".ggen")));
    }

    @Test
    void invalidOutputFailsValidationWithoutWriting() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "templates/a.rs.tera", BROKEN_RUST_TEMPLATE);

        ProofGenException ex = assertThrows(ProofGenException.class, this::apply);

        assertEquals(ProofGenErrorCode.OUTPUT_VALIDATION_FAILED.name(), ex.getErrorCode());
        assertTrue(ex.getMetaData().containsKey("issues"));
        assertFalse(Files.exists(root.resolve("out/a.rs")));
    }

    @Test
    void validationCanBeSwitchedOff() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "templates/a.rs.tera", BROKEN_RUST_TEMPLATE);

        CompilationSummary summary = ctx.compiler.generate(
                GenerateCommand.builder().workspaceRoot(root).preview(false).validate(false).build());

        assertEquals(List.of(OutputStatus.CREATED), statuses(summary));
    }

    @Test
    void untrackedFilesUnderGeneratedRootAreReportedAsOrphans() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, "out/legacy.rs", "struct Legacy;");

        CompilationSummary summary = apply();

        assertEquals(List.of("out/legacy.rs"), summary.orphanedFiles());
        assertTrue(Files.exists(root.resolve("out/legacy.rs")));
    }

    @Test
    void trackerForgetsOutputsThatNoLongerExist() {
        TestWorkspaces.standard(root);
        TestWorkspaces.write(root, ".ggen/artifacts.json", """
                { "out/gone.rs": { "ontology_hash": "o", "template_hash": "t", "artifact_hash": "a" } }
                """);

        apply();

        assertEquals(List.of("out/a.rs"), ctx.trackerFactory.load(root).trackedPaths());
    }

    @Test
    void interruptedCallerCancelsTheRun() {
        TestWorkspaces.standard(root);
        Thread.currentThread().interrupt();
        try {
            ProofGenException ex = assertThrows(ProofGenException.class, this::apply);
            assertEquals(ProofGenErrorCode.RUN_CANCELLED.name(), ex.getErrorCode());
        }
        finally {
            Thread.interrupted();
        }
    }

    @Test
    void missingWorkspaceIsReported() {
        ProofGenException ex = assertThrows(ProofGenException.class, () -> ctx.compiler.generate(
                GenerateCommand.builder().workspaceRoot(root.resolve("nope")).build()));

        assertEquals(ProofGenErrorCode.WORKSPACE_NOT_FOUND.name(), ex.getErrorCode());
    }

    private CompilationSummary apply() {
        return ctx.compiler.generate(GenerateCommand.builder().workspaceRoot(root).preview(false).build());
    }

    private static List<OutputStatus> statuses(CompilationSummary summary) {
        return summary.outputs().stream().map(ReceiptOutput::status).toList();
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static GuardStatus verdict(CompilationSummary summary, String guardId) {
        return summary.guards().stream()
                .filter(v -> v.guardId().equals(guardId))
                .findFirst()
                .orElseThrow()
                .status();
    }
}
