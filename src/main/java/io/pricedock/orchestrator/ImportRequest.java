package io.pricedock.orchestrator;

import io.pricedock.model.ProcessingMode;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

public record ImportRequest(
        String target,
        Path filePath,
        LocalDate asOfDate,
        Instant asOfDateTime,
        String triggeredBy,
        ProcessingMode processingMode,
        boolean recordSkippedAttempt,
        Map<String, Object> envelopeMetadata,
        Map<String, Object> options
) {
    public ImportRequest {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target must not be blank");
        }
        if (filePath == null) {
            throw new IllegalArgumentException("filePath is required");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("asOfDate is required");
        }
        triggeredBy = triggeredBy == null || triggeredBy.isBlank() ? "manual" : triggeredBy;
        processingMode = processingMode == null ? ProcessingMode.ATOMIC : processingMode;
        envelopeMetadata = envelopeMetadata == null ? Map.of() : Map.copyOf(envelopeMetadata);
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public static ImportRequest of(String target, Path filePath, LocalDate asOfDate, String triggeredBy) {
        return new ImportRequest(target, filePath, asOfDate, null, triggeredBy, ProcessingMode.ATOMIC, true,
                Map.of(), Map.of());
    }
}
