package io.pricedock.orchestrator;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What an import reports back. Metric keys outside the run ledger's whitelist are dropped.
 */
public record ImportPayload(Map<String, Object> metrics, Map<String, String> artifacts) {
    public ImportPayload {
        metrics = metrics == null ? Map.of() : new LinkedHashMap<>(metrics);
        artifacts = artifacts == null ? Map.of() : new LinkedHashMap<>(artifacts);
    }

    public static ImportPayload empty() {
        return new ImportPayload(Map.of(), Map.of());
    }

    public static ImportPayload ofMetrics(Map<String, ?> metrics) {
        return new ImportPayload(new LinkedHashMap<>(metrics), Map.of());
    }
}
