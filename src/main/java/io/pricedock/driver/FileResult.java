package io.pricedock.driver;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.util.Jsons;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Per-file entry of the daily-import document.
 */
public record FileResult(
        String originalName,
        String originalPath,
        SelectedMode selectedMode,
        FileOutcome status,
        SkipReason skipReason,
        LocalDate effectiveDate,
        String importRunId,
        String envelopeId,
        long rowsGood,
        long rowsQuarantine,
        String sha256,
        Instant startedAt,
        Instant finishedAt,
        String archivePath,
        String quarantinePath,
        String error
) {
    static final int ERROR_MAX_CHARS = 500;

    public FileResult {
        if (error != null && error.length() > ERROR_MAX_CHARS) {
            error = error.substring(0, ERROR_MAX_CHARS);
        }
    }

    static FileResult rejected(String name, SelectedMode mode, FileOutcome status, SkipReason reason,
                               String error, Instant at) {
        return new FileResult(name, null, mode, status, reason, EffectiveDates.fromFileName(name).orElse(null),
                null, null, 0L, 0L, null, at, at, null, null, error);
    }

    public ObjectNode toJson() {
        ObjectNode node = Jsons.mapper().createObjectNode();
        node.put("original_name", originalName);
        node.put("original_path", originalPath);
        node.put("selected_mode", selectedMode.name());
        node.put("status", status.name());
        node.put("skip_reason", skipReason == null ? null : skipReason.name());
        node.put("effective_date", effectiveDate == null ? null : effectiveDate.toString());
        node.put("import_run_id", importRunId);
        node.put("envelope_id", envelopeId);
        node.put("rows_good", rowsGood);
        node.put("rows_quarantine", rowsQuarantine);
        node.put("sha256", sha256);
        node.put("started_at", startedAt == null ? null : startedAt.toString());
        node.put("finished_at", finishedAt == null ? null : finishedAt.toString());
        if (startedAt != null && finishedAt != null) {
            node.put("duration_ms", Duration.between(startedAt, finishedAt).toMillis());
        } else {
            node.putNull("duration_ms");
        }
        node.put("archive_path", archivePath);
        node.put("quarantine_path", quarantinePath);
        node.put("error", error);
        return node;
    }
}
