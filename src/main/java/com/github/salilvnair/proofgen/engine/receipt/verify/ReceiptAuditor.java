package com.github.salilvnair.proofgen.engine.receipt.verify;

import com.github.salilvnair.proofgen.audit.AuditService;
import com.github.salilvnair.proofgen.audit.ProofGenAuditStage;
import com.github.salilvnair.proofgen.engine.exception.ProofGenException;
import com.github.salilvnair.proofgen.engine.receipt.ReceiptStore;
import com.github.salilvnair.proofgen.engine.receipt.model.GenerationReceipt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verify entry point: loads a receipt leniently and audits it. Audit failures are reported in the result,
 * never thrown.
 */
@Slf4j
@RequiredArgsConstructor
@Component
public class ReceiptAuditor {

    private final ReceiptStore store;
    private final ReceiptVerifier verifier;
    private final AuditService audit;

    public VerificationResult verify(Path receiptPath) {
        VerificationResult result;
        String receiptId = null;
        try {
            GenerationReceipt receipt = store.load(receiptPath);
            receiptId = receipt.receiptId();
            result = verifier.verify(receipt, receiptPath);
        }
        catch (ProofGenException e) {
            log.warn("Receipt {} could not be loaded: {}", receiptPath, e.getMessage());
            result = verifier.unreadable(receiptPath, e.getMessage());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("receiptPath", String.valueOf(receiptPath));
        payload.put("result", result.result());
        payload.put("failedChecks", result.failures().stream().map(VerificationCheck::checkId).toList());
        audit.audit(ProofGenAuditStage.VERIFY_COMPLETE, receiptId == null ? "-" : receiptId, payload);
        return result;
    }
}
