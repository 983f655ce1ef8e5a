package io.pricedock.supervisor;

import io.pricedock.model.ImportMode;

import java.util.List;
import java.util.UUID;

public record SupervisedRequest(String runId, ImportMode mode, List<String> files) {
    public SupervisedRequest {
        runId = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId.trim();
        StatusDocumentStore.validRunId(runId);
        mode = mode == null ? ImportMode.AUTO : mode;
        files = files == null ? List.of() : List.copyOf(files);
        if (mode == ImportMode.FILES && files.isEmpty()) {
            throw new IllegalArgumentException("mode files requires at least one file");
        }
    }
}
