package com.github.salilvnair.proofgen.audit;

import com.github.salilvnair.proofgen.util.JsonUtil;

import java.util.LinkedHashMap;
import java.util.Map;

public interface AuditService {
    void audit(String stage, String runId, String payloadJson);

    default void audit(ProofGenAuditStage stage, String runId, String payloadJson) {
        audit(stage.value(), runId, payloadJson);
    }

    default void audit(String stage, String runId, Map<String, ?> payload) {
        audit(stage, runId, JsonUtil.toJson(payload == null ? Map.of() : payload));
    }

    default void audit(ProofGenAuditStage stage, String runId, Map<String, ?> payload) {
        audit(stage.value(), runId, payload);
    }

    default void audit(String stage, String runId, Object payload) {
        if (payload == null) {
            audit(stage, runId, "{}");
            return;
        }
        if (payload instanceof String s) {
            audit(stage, runId, s);
            return;
        }
        if (payload instanceof Map<?, ?> map) {
            Map<String, Object> normalized = new LinkedHashMap<>();
            map.forEach((k, v) -> normalized.put(String.valueOf(k), v));
            audit(stage, runId, normalized);
            return;
        }
        audit(stage, runId, JsonUtil.toJson(payload));
    }
}
