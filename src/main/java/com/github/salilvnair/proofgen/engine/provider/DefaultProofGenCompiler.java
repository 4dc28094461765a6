package com.github.salilvnair.proofgen.engine.provider;

import com.github.salilvnair.proofgen.audit.AuditService;
import com.github.salilvnair.proofgen.audit.ProofGenAuditStage;
import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.config.ProofGenWorkerPool;
import com.github.salilvnair.proofgen.engine.core.ProofGenCompiler;
import com.github.salilvnair.proofgen.engine.exception.GuardFailureException;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardEvaluation;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOptions;
import com.github.salilvnair.proofgen.engine.guard.kernel.GuardKernel;
import com.github.salilvnair.proofgen.engine.guard.provider.OutputOverlapGuard;
import com.github.salilvnair.proofgen.engine.model.CompilationSummary;
import com.github.salilvnair.proofgen.engine.model.GenerateCommand;
import com.github.salilvnair.proofgen.engine.model.RunStatus;
import com.github.salilvnair.proofgen.engine.receipt.ReceiptGenerator;
import com.github.salilvnair.proofgen.engine.receipt.ReceiptStore;
import com.github.salilvnair.proofgen.engine.receipt.model.GenerationReceipt;
import com.github.salilvnair.proofgen.engine.receipt.model.OutputStatus;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptArtifacts;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptOutput;
import com.github.salilvnair.proofgen.engine.receipt.model.ReceiptPerformance;
import com.github.salilvnair.proofgen.engine.receipt.model.SyncMode;
import com.github.salilvnair.proofgen.engine.receipt.verify.ReceiptAuditor;
import com.github.salilvnair.proofgen.engine.receipt.verify.VerificationResult;
import com.github.salilvnair.proofgen.engine.render.RenderAttempt;
import com.github.salilvnair.proofgen.engine.render.RenderedArtifact;
import com.github.salilvnair.proofgen.engine.render.RuleRenderer;
import com.github.salilvnair.proofgen.engine.report.DiffWriter;
import com.github.salilvnair.proofgen.engine.report.FileChange;
import com.github.salilvnair.proofgen.engine.report.ReportWriter;
import com.github.salilvnair.proofgen.engine.tracker.ArtifactRecord;
import com.github.salilvnair.proofgen.engine.tracker.ArtifactTracker;
import com.github.salilvnair.proofgen.engine.tracker.ArtifactTrackerFactory;
import com.github.salilvnair.proofgen.engine.tracker.ProvenanceHashes;
import com.github.salilvnair.proofgen.engine.validate.OutputValidator;
import com.github.salilvnair.proofgen.engine.workspace.GenerationRule;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceContext;
import com.github.salilvnair.proofgen.engine.workspace.WorkspaceDiscovery;
import com.github.salilvnair.proofgen.engine.workspace.WorkspacePaths;
import com.github.salilvnair.proofgen.engine.writer.AtomicFileWriter;
import com.github.salilvnair.proofgen.engine.writer.FileTransaction;
import com.github.salilvnair.proofgen.util.LanguageUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * The generate pipeline: discovery, guard gate, cache-aware extraction and rendering, validation,
 * transactional write, tracker update, report and diff, receipt.
 * <p>
 * Preview runs never touch generated outputs or the tracker state but always leave a receipt.
 * Under force, rules that cannot be rendered or written safely are left out and listed as not
 * produced; the receipt still records every guard verdict.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class DefaultProofGenCompiler implements ProofGenCompiler {

    static final String STAGE_DISCOVERY = "discovery";
    static final String STAGE_GUARDS = "guards";
    static final String STAGE_SPARQL = "sparql";
    static final String STAGE_RENDER = "render";
    static final String STAGE_VALIDATE = "validate";
    static final String STAGE_WRITE = "write";

    private final ProofGenConfig config;
    private final WorkspaceDiscovery discovery;
    private final GuardKernel guardKernel;
    private final RuleRenderer ruleRenderer;
    private final ArtifactTrackerFactory trackerFactory;
    private final ProvenanceHashes provenance;
    private final OutputValidator outputValidator;
    private final AtomicFileWriter fileWriter;
    private final ReceiptGenerator receiptGenerator;
    private final ReceiptStore receiptStore;
    private final ReceiptAuditor receiptAuditor;
    private final ReportWriter reportWriter;
    private final DiffWriter diffWriter;
    private final ProofGenWorkerPool workerPool;
    private final AuditService audit;

    @Override
    public CompilationSummary generate(GenerateCommand command) {
        if (command == null || command.getWorkspaceRoot() == null) {
            throw new ProofGenException(ProofGenErrorCode.WORKSPACE_NOT_FOUND, "No workspace root given");
        }
        String runId = UUID.randomUUID().toString();
        SyncMode mode = command.isPreview() ? SyncMode.PREVIEW : SyncMode.APPLY;

        Map<String, Object> started = new LinkedHashMap<>();
        started.put("workspaceRoot", String.valueOf(command.getWorkspaceRoot()));
        started.put("mode", mode.value());
        started.put("force", command.isForce());
        started.put("validateOnly", command.isValidateOnly());
        audit.audit(ProofGenAuditStage.RUN_STARTED, runId, started);

        try {
            return run(command, runId, mode);
        }
        catch (GuardFailureException e) {
            throw e;
        }
        catch (RuntimeException e) {
            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put("errorType", e.getClass().getSimpleName());
            failed.put("errorCode", e instanceof ProofGenException pge ? pge.getErrorCode() : "");
            failed.put("errorMessage", String.valueOf(e.getMessage()));
            audit.audit(ProofGenAuditStage.RUN_FAILED, runId, failed);
            throw e;
        }
    }

    @Override
    public VerificationResult verify(Path receiptPath) {
        return receiptAuditor.verify(receiptPath);
    }

    private CompilationSummary run(GenerateCommand command, String runId, SyncMode mode) {
        long start = System.nanoTime();
        Map<String, Long> stages = new LinkedHashMap<>();

        WorkspaceContext workspace = timed(stages, STAGE_DISCOVERY, () -> discovery.discover(command.getWorkspaceRoot()));
        Path root = workspace.getRoot();
        audit.audit(ProofGenAuditStage.DISCOVERY_COMPLETE, runId, Map.of(
                "inputs", workspace.getInputs().size(),
                "rules", workspace.getRules().size(),
                "fingerprint", workspace.getFingerprint()));

        GuardOptions options = new GuardOptions(
                workspace.getGuardSettings().isFailFast(),
                command.isForce(),
                command.isValidateOnly(),
                config.getGuard().isExecuteQueriesInValidateOnly());
        GuardContext guardContext = new GuardContext(workspace, options, ruleRenderer);
        GuardEvaluation evaluation = timed(stages, STAGE_GUARDS, () -> guardKernel.evaluate(guardContext, runId));

        if (!evaluation.passed() && !command.isForce()) {
            audit.audit(ProofGenAuditStage.RUN_BLOCKED, runId, Map.of(
                    "failedGuard", evaluation.failedGuardId(),
                    "failures", evaluation.failures().size()));
            throw new GuardFailureException(evaluation.failedGuardId(), evaluation.verdicts());
        }
        if (!evaluation.passed()) {
            log.warn("Forced past guard failures: {}", evaluation.failures().stream()
                    .map(v -> v.guardId() + " " + v.diagnostic()).toList());
        }

        if (command.isValidateOnly()) {
            CompilationSummary summary = CompilationSummary.builder()
                    .runId(runId)
                    .mode(mode)
                    .status(RunStatus.VALIDATED)
                    .guards(evaluation.verdicts())
                    .performance(new ReceiptPerformance(elapsedMs(start), 0.0, stages))
                    .build();
            audit.audit(ProofGenAuditStage.RUN_COMPLETE, runId, Map.of("status", summary.status()));
            return summary;
        }

        // tracker cache; unsafe outputs are never produced, only reachable under force
        ArtifactTracker tracker = trackerFactory.load(root);
        String ontologyHash = provenance.ontologyHash(workspace);
        List<GenerationRule> toRender = new ArrayList<>();
        Map<String, ReceiptOutput> cached = new LinkedHashMap<>();
        List<String> skipped = new ArrayList<>();
        for (GenerationRule rule : workspace.getRules()) {
            if (!isSafe(root, rule.output())) {
                skip(skipped, rule, "output " + rule.output() + " is outside the workspace root", runId);
                continue;
            }
            String templateHash = provenance.templateHash(workspace, rule);
            if (!command.isForce() && !tracker.isStale(Path.of(rule.output()), ontologyHash, templateHash)) {
                cached.put(outputKey(rule), cachedOutput(root, rule, tracker.getRecord(Path.of(rule.output()))));
                audit.audit(ProofGenAuditStage.ARTIFACT_UNCHANGED, runId, Map.of("path", rule.output()));
            }
            else {
                toRender.add(rule);
            }
        }

        checkCancelled();
        long renderStart = System.nanoTime();
        boolean parallel = evaluation.passed(OutputOverlapGuard.ID);
        List<RenderAttempt> attempts = renderAll(guardContext, toRender, parallel);
        long renderWall = elapsedMs(renderStart);

        // later rules win when outputs overlap under force
        Map<String, RenderedArtifact> byOutput = new LinkedHashMap<>();
        for (RenderAttempt attempt : attempts) {
            if (!attempt.succeeded()) {
                if (!command.isForce()) {
                    throw attempt.failure();
                }
                skip(skipped, attempt.rule(), attempt.failure().getMessage(), runId);
                continue;
            }
            byOutput.put(outputKey(attempt.rule()), attempt.artifact());
        }
        long extractMs = byOutput.values().stream().mapToLong(RenderedArtifact::extractMs).sum();
        stages.put(STAGE_SPARQL, extractMs);
        stages.put(STAGE_RENDER, Math.max(0, renderWall - extractMs));

        if (command.isValidate() && workspace.isValidateOutputs()) {
            timed(stages, STAGE_VALIDATE, () -> {
                validate(byOutput);
                return null;
            });
        }

        checkCancelled();
        List<FileChange> changes = new ArrayList<>();
        Map<String, ReceiptOutput> outputs = new LinkedHashMap<>(cached);
        for (Map.Entry<String, RenderedArtifact> entry : byOutput.entrySet()) {
            String path = entry.getKey();
            RenderedArtifact artifact = entry.getValue();
            String before = readExisting(root, path);
            changes.add(new FileChange(path, before, artifact.content()));
            outputs.put(path, new ReceiptOutput(path, artifact.contentHash(), artifact.sizeBytes(),
                    status(mode, before, artifact.content()), LanguageUtil.detect(path)));
        }

        if (mode == SyncMode.APPLY) {
            timed(stages, STAGE_WRITE, () -> {
                write(root, byOutput, outputs, runId);
                updateTracker(tracker, workspace, byOutput.values(), ontologyHash, runId);
                return null;
            });
        }

        List<String> orphans = orphans(tracker, workspace);
        if (!orphans.isEmpty()) {
            log.info("{} orphaned files under {}: {}", orphans.size(), workspace.getGeneratedRoot(), orphans);
        }

        ProofGenConfig.Workspace layout = config.getWorkspace();
        String reportPath = trimSlash(layout.getReportsDir()) + "/" + runId + ".md";
        String diffPath = trimSlash(layout.getDiffsDir()) + "/" + runId + ".diff";
        int rules = workspace.getRules().size();
        double cacheHitRate = rules == 0 ? 0.0 : (double) cached.size() / rules;
        ReceiptPerformance performance = new ReceiptPerformance(elapsedMs(start), cacheHitRate, stages);

        GenerationReceipt receipt = receiptGenerator.generate(
                workspace,
                evaluation,
                new ArrayList<>(outputs.values()),
                performance,
                mode,
                new ReceiptArtifacts(reportPath, diffPath));
        Path receiptFile = receiptStore.save(root, receipt);
        audit.audit(ProofGenAuditStage.RECEIPT_WRITTEN, runId, Map.of(
                "receiptId", receipt.receiptId(),
                "path", receiptFile.toString()));

        CompilationSummary summary = CompilationSummary.builder()
                .runId(runId)
                .receiptId(receipt.receiptId())
                .mode(mode)
                .status(evaluation.passed() ? RunStatus.COMPLETED : RunStatus.FORCED)
                .guards(evaluation.verdicts())
                .outputs(receipt.outputs())
                .orphanedFiles(orphans)
                .skippedRules(skipped)
                .receiptPath(receiptFile.toString())
                .reportPath(root.resolve(reportPath).toString())
                .diffPath(root.resolve(diffPath).toString())
                .performance(performance)
                .build();

        writeSideArtifacts(root, runId, workspace, receipt, summary, reportPath, diffPath, changes);

        Map<String, Object> complete = new LinkedHashMap<>();
        complete.put("status", summary.status());
        complete.put("receiptId", receipt.receiptId());
        complete.put("outputs", summary.outputs().size());
        complete.put("skipped", skipped.size());
        complete.put("cacheHitRate", cacheHitRate);
        complete.put("durationMs", performance.totalDurationMs());
        audit.audit(ProofGenAuditStage.RUN_COMPLETE, runId, complete);
        log.info("Run {} {} in {} mode: {} outputs, receipt {}", runId, summary.status(), mode.value(),
                summary.outputs().size(), receipt.receiptId());
        return summary;
    }

    /** Attempts come back in rule order; failures are left to the caller. */
    private List<RenderAttempt> renderAll(GuardContext context, List<GenerationRule> rules, boolean parallel) {
        List<RenderAttempt> rendered = new ArrayList<>();
        if (!parallel || rules.size() < 2) {
            for (GenerationRule rule : rules) {
                checkCancelled();
                rendered.add(context.render(rule));
            }
            return rendered;
        }
        List<Future<RenderAttempt>> futures = new ArrayList<>();
        for (GenerationRule rule : rules) {
            futures.add(workerPool.executor().submit(() -> context.render(rule)));
        }
        try {
            for (Future<RenderAttempt> future : futures) {
                rendered.add(future.get());
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new ProofGenException(ProofGenErrorCode.RUN_CANCELLED, "Rendering interrupted", e);
        }
        catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof ProofGenException pge) {
                throw pge;
            }
            throw new ProofGenException(ProofGenErrorCode.TEMPLATE_RENDER_FAILED, "Rendering failed: " + cause, cause);
        }
        return rendered;
    }

    private void skip(List<String> skipped, GenerationRule rule, String reason, String runId) {
        skipped.add(rule.name() + ": " + reason);
        log.warn("Rule {} not produced: {}", rule.name(), reason);
        audit.audit(ProofGenAuditStage.ARTIFACT_SKIPPED, runId, Map.of(
                "rule", rule.name(),
                "path", String.valueOf(rule.output()),
                "reason", String.valueOf(reason)));
    }

    // only called for outputs that passed isSafe, so normalize never returns null here
    private static String outputKey(GenerationRule rule) {
        return WorkspacePaths.normalize(rule.output());
    }

    private void validate(Map<String, RenderedArtifact> artifacts) {
        List<String> issues = new ArrayList<>();
        artifacts.forEach((path, artifact) ->
                issues.addAll(outputValidator.validate(path, LanguageUtil.detect(path), artifact.content())));
        if (!issues.isEmpty()) {
            throw new ProofGenException(ProofGenErrorCode.OUTPUT_VALIDATION_FAILED,
                    "Generated output failed validation: " + String.join("; ", issues))
                    .withMetaData(Map.of("issues", issues));
        }
    }

    private void write(Path root,
                       Map<String, RenderedArtifact> artifacts,
                       Map<String, ReceiptOutput> outputs,
                       String runId) {
        try (FileTransaction transaction = fileWriter.begin()) {
            for (Map.Entry<String, RenderedArtifact> entry : artifacts.entrySet()) {
                String path = entry.getKey();
                RenderedArtifact artifact = entry.getValue();
                OutputStatus status = outputs.get(path).status();
                if (status == OutputStatus.UNCHANGED) {
                    audit.audit(ProofGenAuditStage.ARTIFACT_UNCHANGED, runId, Map.of("path", path));
                    continue;
                }
                checkCancelled();
                transaction.write(root.resolve(path), artifact.bytes());
                audit.audit(ProofGenAuditStage.ARTIFACT_WRITTEN, runId, Map.of(
                        "path", path,
                        "status", status,
                        "hash", artifact.contentHash()));
            }
            transaction.commit();
        }
    }

    private void updateTracker(ArtifactTracker tracker,
                               WorkspaceContext workspace,
                               Iterable<RenderedArtifact> artifacts,
                               String ontologyHash,
                               String runId) {
        for (RenderedArtifact artifact : artifacts) {
            GenerationRule rule = artifact.rule();
            tracker.recordArtifact(Path.of(rule.output()), ontologyHash,
                    provenance.templateHash(workspace, rule), provenance.dependencies(workspace, rule));
        }
        Set<String> planned = Set.copyOf(workspace.plannedOutputs());
        for (String tracked : tracker.trackedPaths()) {
            if (!planned.contains(tracked) && !Files.exists(workspace.getRoot().resolve(tracked))) {
                tracker.removeArtifact(Path.of(tracked));
                log.debug("Dropped tracker record for vanished output {}", tracked);
            }
        }
        try {
            tracker.save();
            audit.audit(ProofGenAuditStage.TRACKER_SAVED, runId, Map.of("artifacts", tracker.size()));
        }
        catch (ProofGenException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("{}: {}", e.getErrorCode(), e.getMessage());
        }
    }

    private List<String> orphans(ArtifactTracker tracker, WorkspaceContext workspace) {
        String generatedRoot = workspace.getGeneratedRoot();
        if (!isSafe(workspace.getRoot(), generatedRoot)) {
            log.warn("Generated root {} is outside the workspace, orphan scan skipped", generatedRoot);
            return List.of();
        }
        return tracker.findOrphanedFiles(Path.of(generatedRoot));
    }

    private void writeSideArtifacts(Path root,
                                    String runId,
                                    WorkspaceContext workspace,
                                    GenerationReceipt receipt,
                                    CompilationSummary summary,
                                    String reportPath,
                                    String diffPath,
                                    List<FileChange> changes) {
        try {
            reportWriter.write(root.resolve(reportPath), reportWriter.render(workspace, receipt.timestamp(), summary));
            diffWriter.write(root.resolve(diffPath), diffWriter.render(runId, changes));
        }
        catch (ProofGenException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("{}: {}", e.getErrorCode(), e.getMessage());
        }
    }

    private ReceiptOutput cachedOutput(Path root, GenerationRule rule, ArtifactRecord record) {
        String path = outputKey(rule);
        Path file = root.resolve(path);
        try {
            return new ReceiptOutput(path, record.artifactHash(), Files.size(file),
                    OutputStatus.UNCHANGED, LanguageUtil.detect(path));
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.INPUT_READ_FAILED,
                    "Failed to stat cached output " + file + ": " + e.getMessage(), e);
        }
    }

    private static OutputStatus status(SyncMode mode, String before, String after) {
        if (mode == SyncMode.PREVIEW) {
            return OutputStatus.PREVIEW;
        }
        if (before == null) {
            return OutputStatus.CREATED;
        }
        return before.equals(after) ? OutputStatus.UNCHANGED : OutputStatus.UPDATED;
    }

    private static String readExisting(Path root, String path) {
        Path file = root.resolve(WorkspacePaths.normalize(path));
        if (!Files.isRegularFile(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        catch (IOException e) {
            throw new ProofGenException(ProofGenErrorCode.INPUT_READ_FAILED,
                    "Failed to read existing output " + file + ": " + e.getMessage(), e);
        }
    }

    private static boolean isSafe(Path root, String path) {
        return path != null && WorkspacePaths.isSafe(root, path);
    }

    private static <T> T timed(Map<String, Long> stages, String stage, Supplier<T> work) {
        checkCancelled();
        long start = System.nanoTime();
        T result = work.get();
        stages.put(stage, elapsedMs(start));
        return result;
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new ProofGenException(ProofGenErrorCode.RUN_CANCELLED);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String trimSlash(String value) {
        String trimmed = value.replace('\\', '/');
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
