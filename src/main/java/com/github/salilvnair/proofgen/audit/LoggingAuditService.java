package com.github.salilvnair.proofgen.audit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sink: one structured log line per audit event.
 */
@Slf4j
@Component
public class LoggingAuditService implements AuditService {

    @Override
    public void audit(String stage, String runId, String payloadJson) {
        if (stage != null && (stage.endsWith("_FAIL") || stage.endsWith("_ERROR") || stage.endsWith("_FAILED")
                || stage.endsWith("_BLOCKED"))) {
            log.warn("proofgen audit stage={} runId={} payload={}", stage, runId, payloadJson);
            return;
        }
        log.info("proofgen audit stage={} runId={} payload={}", stage, runId, payloadJson);
    }
}
