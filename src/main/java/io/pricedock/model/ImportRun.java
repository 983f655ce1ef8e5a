package io.pricedock.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

public record ImportRun(
        String runId,
        String target,
        String sourceFilename,
        String fileSha256,
        long fileSizeBytes,
        String envelopeId,
        LocalDate asOfDate,
        Instant asOfDateTime,
        ImportRunStatus status,
        String triggeredBy,
        ProcessingMode processingMode,
        Instant createdAt,
        Instant updatedAt,
        Instant startedAt,
        Instant finishedAt,
        Map<String, Long> metrics,
        String errorSummary,
        Map<String, Object> errorDetails,
        Map<String, Object> artifactPaths,
        Map<String, Object> importConfig
) {
    public String describe() {
        return "run_id=" + runId + " status=" + status.dbValue()
                + " created_at=" + createdAt
                + (finishedAt == null ? "" : " finished_at=" + finishedAt);
    }
}
