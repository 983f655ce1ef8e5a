package io.pricedock.orchestrator;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;

public record ImportContext(
        String target,
        Path filePath,
        LocalDate asOfDate,
        String runId,
        String envelopeId,
        Map<String, Object> options
) {
    public ImportContext {
        options = options == null ? Map.of() : Map.copyOf(options);
    }
}
