package io.pricedock.orchestrator;

import java.util.Map;

public record OrchestratorResult(
        Status status,
        String runId,
        String envelopeId,
        String reason,
        String errorType,
        Map<String, Long> metrics
) {
    public enum Status {
        SUCCESS,
        FAILED,
        SKIPPED
    }

    public OrchestratorResult {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    public static OrchestratorResult success(String runId, String envelopeId, Map<String, Long> metrics) {
        return new OrchestratorResult(Status.SUCCESS, runId, envelopeId, null, null, metrics);
    }

    public static OrchestratorResult skipped(String reason) {
        return new OrchestratorResult(Status.SKIPPED, null, null, reason, null, Map.of());
    }

    public static OrchestratorResult failed(String runId, String envelopeId, Throwable error) {
        return new OrchestratorResult(
                Status.FAILED,
                runId,
                envelopeId,
                ImportOrchestrator.errorSummary(error),
                error.getClass().getSimpleName(),
                Map.of()
        );
    }

    public long metric(String key) {
        Long v = metrics.get(key);
        return v == null ? 0L : v;
    }
}
