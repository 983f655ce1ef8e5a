package io.pricedock.supervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.model.ImportMode;
import io.pricedock.model.SupervisedStatus;
import io.pricedock.util.Jsons;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Field names and builders for the per-run status document. Timestamps are ISO-8601 UTC.
 */
public final class StatusDocuments {
    public static final String RUN_ID = "run_id";
    public static final String STATUS = "status";
    public static final String REQUESTED_MODE = "requested_mode";
    public static final String SELECTED_MODE = "selected_mode";
    public static final String STARTED_AT = "started_at";
    public static final String FINISHED_AT = "finished_at";
    public static final String DURATION_MS = "duration_ms";
    public static final String FILES = "files";
    public static final String SUMMARY = "summary";
    public static final String MESSAGE = "message";
    public static final String ERROR = "error";
    public static final String EXIT_CODE = "exit_code";
    public static final String PID = "pid";
    public static final String CHILD_ALIVE = "child_alive";
    public static final String STDOUT_TAIL = "stdout_tail";
    public static final String STDERR_TAIL = "stderr_tail";

    private StatusDocuments() {
    }

    public static ObjectNode running(String runId, ImportMode mode, List<String> files, Instant startedAt) {
        ObjectNode doc = Jsons.mapper().createObjectNode();
        doc.put(RUN_ID, runId);
        doc.put(STATUS, SupervisedStatus.RUNNING.name());
        doc.put(REQUESTED_MODE, mode.cliValue());
        doc.putNull(SELECTED_MODE);
        doc.put(STARTED_AT, startedAt.toString());
        doc.putNull(FINISHED_AT);
        doc.putNull(DURATION_MS);
        ArrayNode pending = doc.putArray(FILES);
        if (mode == ImportMode.FILES) {
            for (String f : files) {
                pending.addObject().put("original_name", f).put("status", "PENDING");
            }
        }
        doc.set(SUMMARY, minimalSummary(mode == ImportMode.FILES ? files.size() : 0));
        doc.put(MESSAGE, "Import in progress...");
        return doc;
    }

    /**
     * Terminal document for a run that produced no worker result of its own. Each requested
     * file is listed as {@code ERROR} and counted as failed when the run timed out or failed.
     */
    public static ObjectNode terminal(String runId, ImportMode mode, List<String> files, SupervisedStatus status,
                                      Instant startedAt, Instant finishedAt, String error) {
        List<String> requested = files == null ? List.of() : files;
        boolean failed = status == SupervisedStatus.FAILED || status == SupervisedStatus.TIMEOUT;
        ObjectNode doc = Jsons.mapper().createObjectNode();
        doc.put(RUN_ID, runId);
        doc.put(STATUS, status.name());
        doc.put(REQUESTED_MODE, mode.cliValue());
        doc.putNull(SELECTED_MODE);
        doc.put(STARTED_AT, startedAt.toString());
        doc.put(FINISHED_AT, finishedAt.toString());
        doc.put(DURATION_MS, Duration.between(startedAt, finishedAt).toMillis());
        ArrayNode entries = doc.putArray(FILES);
        for (String f : requested) {
            ObjectNode entry = entries.addObject().put("original_name", f);
            entry.put("status", failed ? "ERROR" : "PENDING");
        }
        ObjectNode summary = minimalSummary(requested.size());
        if (failed) {
            summary.put("files_failed", requested.size());
        }
        doc.set(SUMMARY, summary);
        if (error != null) {
            doc.put(ERROR, error);
            doc.put(MESSAGE, error);
        }
        return doc;
    }

    public static ObjectNode minimalSummary(int filesTotal) {
        ObjectNode summary = Jsons.mapper().createObjectNode();
        summary.put("files_total", filesTotal);
        summary.put("files_imported", 0);
        summary.put("files_skipped", 0);
        summary.put("files_quarantined", 0);
        summary.put("files_failed", 0);
        summary.put("rows_good_total", 0);
        summary.put("rows_quarantine_total", 0);
        summary.putNull("notes");
        return summary;
    }

    public static SupervisedStatus status(JsonNode doc) {
        JsonNode s = doc == null ? null : doc.get(STATUS);
        return s == null || !s.isTextual() ? SupervisedStatus.FAILED : SupervisedStatus.fromString(s.asText());
    }

    /**
     * Last {@code limit} characters of captured output, with NUL bytes removed; {@code null}
     * for empty output.
     */
    public static String tail(String raw, int limit) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        String s = raw.replace("\u0000", "");
        if (s.length() <= limit) {
            return s;
        }
        return s.substring(s.length() - limit);
    }

    static Instant parseInstant(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
