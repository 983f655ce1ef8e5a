package io.pricedock.supervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.model.ImportMode;
import io.pricedock.model.SupervisedStatus;
import io.pricedock.storage.Database;
import io.pricedock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mirrors status documents into {@code supervised_runs} for history queries. Writes are
 * best-effort: a failure is logged and the file document stays authoritative.
 */
public final class SupervisedRunJournal {
    private static final Logger log = LoggerFactory.getLogger(SupervisedRunJournal.class);

    private final Database database;
    private final Clock clock;

    public SupervisedRunJournal(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    public void recordStart(String runId, ImportMode mode, ObjectNode runningDocument) {
        String sql = """
                INSERT INTO supervised_runs(run_id,requested_mode,status,started_at_ms,summary,log_relpath,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                ON CONFLICT(run_id) DO UPDATE SET
                    requested_mode=excluded.requested_mode,
                    status=excluded.status,
                    started_at_ms=MIN(supervised_runs.started_at_ms, excluded.started_at_ms),
                    summary=excluded.summary,
                    log_relpath=COALESCE(supervised_runs.log_relpath, excluded.log_relpath),
                    updated_at_ms=excluded.updated_at_ms
                """;
        long now = clock.millis();
        Instant startedAt = StatusDocuments.parseInstant(runningDocument.get(StatusDocuments.STARTED_AT));
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, mode.cliValue());
            ps.setString(3, SupervisedStatus.RUNNING.name());
            ps.setLong(4, startedAt == null ? now : startedAt.toEpochMilli());
            ps.setString(5, compactOrNull(runningDocument.get(StatusDocuments.SUMMARY)));
            ps.setString(6, runId + ".json");
            ps.setLong(7, now);
            ps.setLong(8, now);
            ps.executeUpdate();
        } catch (SQLException | RuntimeException e) {
            log.warn("supervised run journal start failed run_id={}", runId, e);
        }
    }

    public void recordFinish(String runId, ImportMode mode, ObjectNode document) {
        String sql = """
                INSERT INTO supervised_runs(run_id,requested_mode,status,selected_mode,started_at_ms,finished_at_ms,
                    duration_ms,summary,result_json,log_relpath,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?,?,?,?)
                ON CONFLICT(run_id) DO UPDATE SET
                    requested_mode=excluded.requested_mode,
                    status=excluded.status,
                    selected_mode=COALESCE(excluded.selected_mode, supervised_runs.selected_mode),
                    started_at_ms=MIN(COALESCE(supervised_runs.started_at_ms, excluded.started_at_ms), excluded.started_at_ms),
                    finished_at_ms=COALESCE(excluded.finished_at_ms, supervised_runs.finished_at_ms),
                    duration_ms=COALESCE(excluded.duration_ms, supervised_runs.duration_ms),
                    summary=COALESCE(excluded.summary, supervised_runs.summary),
                    result_json=COALESCE(excluded.result_json, supervised_runs.result_json),
                    log_relpath=COALESCE(supervised_runs.log_relpath, excluded.log_relpath),
                    updated_at_ms=excluded.updated_at_ms
                """;
        long now = clock.millis();
        Instant finishedAt = StatusDocuments.parseInstant(document.get(StatusDocuments.FINISHED_AT));
        if (finishedAt == null) {
            finishedAt = clock.instant();
        }
        Instant startedAt = StatusDocuments.parseInstant(document.get(StatusDocuments.STARTED_AT));
        Long durationMs = document.hasNonNull(StatusDocuments.DURATION_MS)
                ? document.get(StatusDocuments.DURATION_MS).asLong()
                : null;
        if (durationMs == null && startedAt != null) {
            durationMs = Duration.between(startedAt, finishedAt).toMillis();
        }
        JsonNode summary = document.get(StatusDocuments.SUMMARY);
        JsonNode selectedMode = document.get(StatusDocuments.SELECTED_MODE);
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, mode.cliValue());
            ps.setString(3, StatusDocuments.status(document).name());
            ps.setString(4, selectedMode == null || !selectedMode.isTextual() ? null : selectedMode.asText());
            ps.setLong(5, (startedAt == null ? finishedAt : startedAt).toEpochMilli());
            ps.setLong(6, finishedAt.toEpochMilli());
            if (durationMs == null) {
                ps.setNull(7, Types.INTEGER);
            } else {
                ps.setLong(7, durationMs);
            }
            ps.setString(8, summary != null && summary.isObject() && summary.size() > 0 ? compactOrNull(summary) : null);
            ps.setString(9, document.size() > 0 ? Jsons.toCompactJson(document) : null);
            ps.setString(10, runId + ".json");
            ps.setLong(11, now);
            ps.setLong(12, now);
            ps.executeUpdate();
        } catch (SQLException | RuntimeException e) {
            log.warn("supervised run journal finish failed run_id={}", runId, e);
        }
    }

    public List<SupervisedRunRow> listRecent(int limit) {
        String sql = """
                SELECT run_id,requested_mode,selected_mode,status,started_at_ms,finished_at_ms,duration_ms,summary
                FROM supervised_runs
                ORDER BY started_at_ms DESC, run_id DESC
                LIMIT ?
                """;
        List<SupervisedRunRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long finished = rs.getLong("finished_at_ms");
                    Instant finishedAt = rs.wasNull() ? null : Instant.ofEpochMilli(finished);
                    long duration = rs.getLong("duration_ms");
                    Long durationMs = rs.wasNull() ? null : duration;
                    String summary = rs.getString("summary");
                    out.add(new SupervisedRunRow(
                            rs.getString("run_id"),
                            rs.getString("requested_mode"),
                            rs.getString("selected_mode"),
                            rs.getString("status"),
                            Instant.ofEpochMilli(rs.getLong("started_at_ms")),
                            finishedAt,
                            durationMs,
                            summary == null ? null : Jsons.readTree(summary)
                    ));
                }
            }
            return out;
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Failed to list supervised runs", e);
        }
    }

    private static String compactOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : Jsons.toCompactJson(node);
    }

    public record SupervisedRunRow(
            String runId,
            String requestedMode,
            String selectedMode,
            String status,
            Instant startedAt,
            Instant finishedAt,
            Long durationMs,
            JsonNode summary
    ) {
    }
}
