package com.github.salilvnair.proofgen.engine.guard.kernel;

import com.github.salilvnair.proofgen.audit.AuditService;
import com.github.salilvnair.proofgen.audit.ProofGenAuditStage;
import com.github.salilvnair.proofgen.config.ProofGenConfig;
import com.github.salilvnair.proofgen.config.ProofGenWorkerPool;
import com.github.salilvnair.proofgen.engine.exception.ProofGenErrorCode;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.guard.core.Guard;
import com.github.salilvnair.proofgen.engine.guard.core.GuardContext;
import com.github.salilvnair.proofgen.engine.guard.core.GuardEvaluation;
import com.github.salilvnair.proofgen.engine.guard.core.GuardOutcome;
import com.github.salilvnair.proofgen.engine.guard.core.GuardStatus;
import com.github.salilvnair.proofgen.engine.guard.core.GuardVerdict;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Runs the registered guards in order and aggregates their verdicts.
 * <p>
 * With fail-fast (and no force) the first failure halts evaluation and the remaining guards are recorded
 * as skipped. Otherwise every guard runs, concurrently when parallel evaluation is enabled, and the
 * verdicts are reassembled in declared order. A failing guard never throws; an exception escaping a
 * guard is an infrastructure failure and aborts the run.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class GuardKernel {

    private final GuardRegistry registry;
    private final ProofGenWorkerPool workerPool;
    private final ProofGenConfig config;
    private final AuditService audit;

    public GuardEvaluation evaluate(GuardContext context, String runId) {
        long start = System.nanoTime();
        List<Guard> guards = registry.guards();
        boolean halting = context.getOptions().haltOnFailure();

        List<GuardVerdict> verdicts = !halting && config.getGuard().isParallelEvaluation() && guards.size() > 1
                ? evaluateParallel(guards, context, runId)
                : evaluateSequential(guards, context, runId, halting);

        String failedGuardId = verdicts.stream()
                .filter(GuardVerdict::isFail)
                .map(GuardVerdict::guardId)
                .findFirst()
                .orElse(null);
        GuardStatus overall = failedGuardId == null ? GuardStatus.PASS : GuardStatus.FAIL;
        long durationMs = (System.nanoTime() - start) / 1_000_000;

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("overall", overall);
        payload.put("guards", verdicts.size());
        payload.put("failedGuard", failedGuardId == null ? "" : failedGuardId);
        payload.put("durationMs", durationMs);
        audit.audit(ProofGenAuditStage.GUARDS_COMPLETE, runId, payload);
        log.info("Guard evaluation {} in {}ms ({} guards)", overall, durationMs, verdicts.size());

        return new GuardEvaluation(verdicts, overall, failedGuardId, durationMs);
    }

    private List<GuardVerdict> evaluateSequential(List<Guard> guards, GuardContext context, String runId, boolean halting) {
        List<GuardVerdict> verdicts = new ArrayList<>();
        String haltedBy = null;
        for (Guard guard : guards) {
            if (haltedBy != null) {
                GuardVerdict skipped = GuardVerdict.skipped(guard, haltedBy);
                audit.audit(ProofGenAuditStage.GUARD_SKIP, runId, verdictPayload(skipped, 0));
                verdicts.add(skipped);
                continue;
            }
            GuardVerdict verdict = run(guard, context, runId);
            verdicts.add(verdict);
            if (verdict.isFail() && halting) {
                haltedBy = guard.id();
            }
        }
        return verdicts;
    }

    private List<GuardVerdict> evaluateParallel(List<Guard> guards, GuardContext context, String runId) {
        List<Future<GuardVerdict>> futures = new ArrayList<>();
        for (Guard guard : guards) {
            futures.add(workerPool.executor().submit(() -> run(guard, context, runId)));
        }
        List<GuardVerdict> verdicts = new ArrayList<>();
        try {
            for (Future<GuardVerdict> future : futures) {
                verdicts.add(future.get());
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new ProofGenException(ProofGenErrorCode.RUN_CANCELLED, "Guard evaluation interrupted", e);
        }
        catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof ProofGenException pge) {
                throw pge;
            }
            throw new ProofGenException(ProofGenErrorCode.GUARD_EXECUTION_FAILED,
                    "Guard evaluation failed: " + cause, cause);
        }
        return verdicts;
    }

    private GuardVerdict run(Guard guard, GuardContext context, String runId) {
        long start = System.nanoTime();
        GuardOutcome outcome;
        try {
            outcome = guard.check(context);
        }
        catch (RuntimeException e) {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            Map<String, Object> errorPayload = new LinkedHashMap<>();
            errorPayload.put("guard", guard.id());
            errorPayload.put("durationMs", durationMs);
            errorPayload.put("errorType", e.getClass().getSimpleName());
            errorPayload.put("errorMessage", String.valueOf(e.getMessage()));
            audit.audit(ProofGenAuditStage.GUARD_ERROR, runId, errorPayload);
            if (e instanceof ProofGenException pge) {
                throw pge;
            }
            throw new ProofGenException(ProofGenErrorCode.GUARD_EXECUTION_FAILED,
                    "Guard " + guard.id() + " aborted: " + e.getMessage(), e)
                    .withMetaData(Map.of("guard", guard.id()));
        }
        if (outcome == null) {
            throw new ProofGenException(ProofGenErrorCode.GUARD_EXECUTION_FAILED,
                    "Guard " + guard.id() + " returned no outcome");
        }
        GuardVerdict verdict = GuardVerdict.of(guard, outcome);
        long durationMs = (System.nanoTime() - start) / 1_000_000;
        audit.audit(verdict.isFail() ? ProofGenAuditStage.GUARD_FAIL : ProofGenAuditStage.GUARD_PASS,
                runId, verdictPayload(verdict, durationMs));
        log.debug("Guard {} {} in {}ms: {}", guard.id(), verdict.status(), durationMs, verdict.diagnostic());
        return verdict;
    }

    private Map<String, Object> verdictPayload(GuardVerdict verdict, long durationMs) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("guard", verdict.guardId());
        payload.put("name", verdict.guardName());
        payload.put("status", verdict.status());
        payload.put("diagnostic", String.valueOf(verdict.diagnostic()));
        payload.put("durationMs", durationMs);
        return payload;
    }
}
