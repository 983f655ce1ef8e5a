package io.pricedock.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Whitelist of counters an import may report on its run. Unknown keys are dropped
 * with a warning rather than rejected.
 */
public final class RunMetrics {
    public static final String TOTAL_ROWS_PROCESSED = "total_rows_processed";
    public static final String NEW_SKU_COUNT = "new_sku_count";
    public static final String UPDATED_SKU_COUNT = "updated_sku_count";
    public static final String NEW_WINERY_COUNT = "new_winery_count";
    public static final String QUARANTINE_COUNT = "quarantine_count";
    public static final String ROWS_SKIPPED = "rows_skipped";

    public static final List<String> COLUMNS = List.of(
            TOTAL_ROWS_PROCESSED,
            NEW_SKU_COUNT,
            UPDATED_SKU_COUNT,
            NEW_WINERY_COUNT,
            QUARANTINE_COUNT,
            ROWS_SKIPPED
    );

    private static final Logger log = LoggerFactory.getLogger(RunMetrics.class);

    private RunMetrics() {
    }

    public static Map<String, Long> filter(Map<String, ?> raw) {
        Map<String, Long> out = new LinkedHashMap<>();
        if (raw == null) {
            return out;
        }
        for (Map.Entry<String, ?> e : raw.entrySet()) {
            String key = e.getKey();
            if (!COLUMNS.contains(key)) {
                log.warn("Dropping unknown import metric key={}", key);
                continue;
            }
            Long value = toLong(e.getValue());
            if (value == null) {
                log.warn("Dropping non-numeric import metric key={} value={}", key, e.getValue());
                continue;
            }
            out.put(key, value);
        }
        return out;
    }

    private static Long toLong(Object value) {
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }
}
