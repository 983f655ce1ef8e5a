package io.pricedock.registry;

import io.pricedock.ingest.FileFingerprint;
import io.pricedock.model.AttemptAction;
import io.pricedock.model.AttemptDecision;
import io.pricedock.model.ImportRun;
import io.pricedock.model.ImportRunStatus;
import io.pricedock.model.ProcessingMode;
import io.pricedock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Ledger of import attempts keyed by {@code (target, file_sha256, as_of_date)}.
 *
 * <p>Every method runs on the connection handed to the constructor and never commits;
 * the caller owns transaction boundaries. Transitions are guarded updates: a row
 * that is not in the expected status is left untouched and
 * {@link IllegalRunTransitionException} is raised.
 */
public final class ImportRunRegistry {
    private static final Logger log = LoggerFactory.getLogger(ImportRunRegistry.class);
    private static final int SQLITE_CONSTRAINT = 19;
    private static final String RUN_COLUMNS = """
            run_id,target,source_filename,file_sha256,file_size_bytes,envelope_id,as_of_date,as_of_datetime_ms,
            status,triggered_by,processing_mode,created_at_ms,updated_at_ms,started_at_ms,finished_at_ms,
            total_rows_processed,new_sku_count,updated_sku_count,new_winery_count,quarantine_count,rows_skipped,
            error_summary,error_details,artifact_paths,import_config
            """;

    private final Connection connection;
    private final ProcessingMode processingMode;
    private final Clock clock;

    public ImportRunRegistry(Connection connection) {
        this(connection, ProcessingMode.ATOMIC, Clock.systemUTC());
    }

    public ImportRunRegistry(Connection connection, ProcessingMode processingMode, Clock clock) {
        this.connection = connection;
        this.processingMode = processingMode == null ? ProcessingMode.ATOMIC : processingMode;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public AttemptDecision checkAttemptOrGetBlocker(String target, FileFingerprint file, LocalDate asOfDate) {
        try {
            Optional<ImportRun> blocker = newestWithStatus(target, file.sha256(), asOfDate, ImportRunStatus.BLOCKING);
            if (blocker.isPresent()) {
                AttemptAction action = blocker.get().status() == ImportRunStatus.SUCCESS
                        ? AttemptAction.SKIP_ALREADY_SUCCESS
                        : AttemptAction.SKIP_ALREADY_RUNNING;
                return new AttemptDecision(action, blocker.get());
            }
            Optional<ImportRun> previous = newestWithStatus(
                    target,
                    file.sha256(),
                    asOfDate,
                    Set.of(ImportRunStatus.FAILED, ImportRunStatus.ROLLED_BACK)
            );
            return previous
                    .map(run -> new AttemptDecision(AttemptAction.RETRY_AFTER_FAILED, run))
                    .orElseGet(AttemptDecision::start);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to check import attempt", e);
        }
    }

    public String createAttempt(NewAttempt attempt) {
        String runId = UUID.randomUUID().toString();
        long now = clock.millis();
        String sql = """
                INSERT INTO import_runs(
                    run_id,target,source_filename,file_sha256,file_size_bytes,envelope_id,as_of_date,
                    as_of_datetime_ms,status,triggered_by,processing_mode,created_at_ms,updated_at_ms,import_config
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, attempt.target());
            ps.setString(3, attempt.file().fileName());
            ps.setString(4, attempt.file().sha256());
            ps.setLong(5, attempt.file().sizeBytes());
            ps.setString(6, attempt.envelopeId());
            ps.setString(7, attempt.asOfDate().toString());
            setNullableInstant(ps, 8, attempt.asOfDateTime());
            ps.setString(9, ImportRunStatus.PENDING.dbValue());
            ps.setString(10, attempt.triggeredBy());
            ps.setString(11, processingMode.dbValue());
            ps.setLong(12, now);
            ps.setLong(13, now);
            ps.setString(14, jsonOrNull(attempt.importConfig()));
            ps.executeUpdate();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new RunConflictException(attempt.target(), attempt.file().sha256(), attempt.asOfDate(), e);
            }
            throw new RuntimeException("Failed to create import attempt", e);
        }
        log.info("import attempt created run_id={} target={} file={} as_of_date={}",
                runId, attempt.target(), attempt.file().fileName(), attempt.asOfDate());
        return runId;
    }

    public void markRunning(String runId) {
        long now = clock.millis();
        guardedUpdate(
                runId,
                Set.of(ImportRunStatus.PENDING),
                "UPDATE import_runs SET status=?,started_at_ms=?,updated_at_ms=? WHERE run_id=? AND status=?",
                ps -> {
                    ps.setString(1, ImportRunStatus.RUNNING.dbValue());
                    ps.setLong(2, now);
                    ps.setLong(3, now);
                    ps.setString(4, runId);
                    ps.setString(5, ImportRunStatus.PENDING.dbValue());
                }
        );
    }

    public void attachEnvelope(String runId, String envelopeId) {
        long now = clock.millis();
        guardedUpdate(
                runId,
                Set.of(ImportRunStatus.PENDING, ImportRunStatus.RUNNING),
                "UPDATE import_runs SET envelope_id=?,updated_at_ms=? WHERE run_id=? AND status IN (?,?)",
                ps -> {
                    ps.setString(1, envelopeId);
                    ps.setLong(2, now);
                    ps.setString(3, runId);
                    ps.setString(4, ImportRunStatus.PENDING.dbValue());
                    ps.setString(5, ImportRunStatus.RUNNING.dbValue());
                }
        );
    }

    public void markSuccess(String runId, Map<String, ?> metrics, Map<String, ?> artifacts, String envelopeId) {
        Map<String, Long> accepted = RunMetrics.filter(metrics);
        long now = clock.millis();
        StringBuilder sql = new StringBuilder("UPDATE import_runs SET status=?,finished_at_ms=?,updated_at_ms=?");
        for (String column : RunMetrics.COLUMNS) {
            sql.append(',').append(column).append("=?");
        }
        sql.append(",artifact_paths=COALESCE(?,artifact_paths),envelope_id=COALESCE(?,envelope_id)");
        sql.append(" WHERE run_id=? AND status=?");
        guardedUpdate(
                runId,
                Set.of(ImportRunStatus.RUNNING),
                sql.toString(),
                ps -> {
                    int i = 1;
                    ps.setString(i++, ImportRunStatus.SUCCESS.dbValue());
                    ps.setLong(i++, now);
                    ps.setLong(i++, now);
                    for (String column : RunMetrics.COLUMNS) {
                        Long value = accepted.get(column);
                        if (value == null) {
                            ps.setNull(i++, Types.INTEGER);
                        } else {
                            ps.setLong(i++, value);
                        }
                    }
                    ps.setString(i++, artifacts == null || artifacts.isEmpty() ? null : Jsons.toCompactJson(artifacts));
                    ps.setString(i++, envelopeId);
                    ps.setString(i++, runId);
                    ps.setString(i, ImportRunStatus.RUNNING.dbValue());
                }
        );
        log.info("import_run_success run_id={} metrics={}", runId, accepted);
    }

    public void markFailed(String runId, String errorSummary, Map<String, ?> errorDetails) {
        long now = clock.millis();
        guardedUpdate(
                runId,
                Set.of(ImportRunStatus.RUNNING),
                "UPDATE import_runs SET status=?,finished_at_ms=?,updated_at_ms=?,error_summary=?,error_details=? WHERE run_id=? AND status=?",
                ps -> {
                    ps.setString(1, ImportRunStatus.FAILED.dbValue());
                    ps.setLong(2, now);
                    ps.setLong(3, now);
                    ps.setString(4, errorSummary);
                    ps.setString(5, jsonOrNull(errorDetails));
                    ps.setString(6, runId);
                    ps.setString(7, ImportRunStatus.RUNNING.dbValue());
                }
        );
        log.error("import_run_failed run_id={} error={}", runId, errorSummary);
    }

    /**
     * Inserts a terminal audit row for a skipped attempt. Skipped rows sit outside the
     * blocking index, so this never conflicts.
     */
    public String createSkippedAttempt(NewAttempt attempt, String reason) {
        String runId = UUID.randomUUID().toString();
        long now = clock.millis();
        String sql = """
                INSERT INTO import_runs(
                    run_id,target,source_filename,file_sha256,file_size_bytes,envelope_id,as_of_date,
                    as_of_datetime_ms,status,triggered_by,processing_mode,created_at_ms,updated_at_ms,
                    finished_at_ms,error_summary,import_config
                ) VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
                """;
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, runId);
            ps.setString(2, attempt.target());
            ps.setString(3, attempt.file().fileName());
            ps.setString(4, attempt.file().sha256());
            ps.setLong(5, attempt.file().sizeBytes());
            ps.setString(6, attempt.envelopeId());
            ps.setString(7, attempt.asOfDate().toString());
            setNullableInstant(ps, 8, attempt.asOfDateTime());
            ps.setString(9, ImportRunStatus.SKIPPED.dbValue());
            ps.setString(10, attempt.triggeredBy());
            ps.setString(11, processingMode.dbValue());
            ps.setLong(12, now);
            ps.setLong(13, now);
            ps.setLong(14, now);
            ps.setString(15, reason);
            ps.setString(16, jsonOrNull(attempt.importConfig()));
            ps.executeUpdate();
            return runId;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record skipped import attempt", e);
        }
    }

    public Optional<ImportRun> findRun(String runId) {
        String sql = "SELECT " + RUN_COLUMNS + " FROM import_runs WHERE run_id=?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRun(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read import run: " + runId, e);
        }
    }

    public List<ImportRun> listRecent(int limit, String target, ImportRunStatus status) {
        StringBuilder sql = new StringBuilder("SELECT ").append(RUN_COLUMNS).append(" FROM import_runs WHERE 1=1");
        List<String> args = new ArrayList<>();
        if (target != null && !target.isBlank()) {
            sql.append(" AND target=?");
            args.add(target);
        }
        if (status != null) {
            sql.append(" AND status=?");
            args.add(status.dbValue());
        }
        sql.append(" ORDER BY created_at_ms DESC, rowid DESC LIMIT ?");
        List<ImportRun> out = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql.toString())) {
            int i = 1;
            for (String arg : args) {
                ps.setString(i++, arg);
            }
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list import runs", e);
        }
    }

    public StalenessReport staleness(String target) {
        Instant now = clock.instant();
        long weekAgo = now.minus(Duration.ofDays(7)).toEpochMilli();
        try {
            Instant lastSuccess = null;
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT MAX(finished_at_ms) FROM import_runs WHERE target=? AND status=?")) {
                ps.setString(1, target);
                ps.setString(2, ImportRunStatus.SUCCESS.dbValue());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        long v = rs.getLong(1);
                        lastSuccess = rs.wasNull() ? null : Instant.ofEpochMilli(v);
                    }
                }
            }
            int failed = countSince(target, ImportRunStatus.FAILED, weekAgo);
            int succeeded = countSince(target, ImportRunStatus.SUCCESS, weekAgo);
            boolean running;
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT 1 FROM import_runs WHERE target=? AND status=? LIMIT 1")) {
                ps.setString(1, target);
                ps.setString(2, ImportRunStatus.RUNNING.dbValue());
                try (ResultSet rs = ps.executeQuery()) {
                    running = rs.next();
                }
            }
            String lastError = null;
            try (PreparedStatement ps = connection.prepareStatement(
                    "SELECT error_summary FROM import_runs WHERE target=? AND status=? ORDER BY finished_at_ms DESC LIMIT 1")) {
                ps.setString(1, target);
                ps.setString(2, ImportRunStatus.FAILED.dbValue());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        lastError = rs.getString(1);
                    }
                }
            }
            Double hoursSinceSuccess = lastSuccess == null
                    ? null
                    : Duration.between(lastSuccess, now).toMinutes() / 60.0d;
            return new StalenessReport(target, lastSuccess, hoursSinceSuccess, failed, succeeded, running, lastError);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute staleness for target: " + target, e);
        }
    }

    /**
     * Runs in {@code status} started (running) or created (pending) at or before the
     * cutoff, oldest first.
     */
    public List<StaleCandidate> findStaleCandidates(ImportRunStatus status, long cutoffMs, int limit) {
        String column = staleColumn(status);
        String sql = "SELECT run_id," + column + " AS ts FROM import_runs WHERE status=? AND " + column
                + "<=? ORDER BY " + column + " ASC LIMIT ?";
        List<StaleCandidate> out = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, status.dbValue());
            ps.setLong(2, cutoffMs);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new StaleCandidate(rs.getString("run_id"), status, Instant.ofEpochMilli(rs.getLong("ts"))));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed stale run scan", e);
        }
    }

    /**
     * Moves a run to {@code rolled_back} only if it is still in {@code expected} and still
     * older than the cutoff. Returns {@code false} when another actor got there first.
     */
    public boolean rollBackIfStale(String runId, ImportRunStatus expected, long cutoffMs, String summary,
                                   Map<String, ?> details) {
        String column = staleColumn(expected);
        long now = clock.millis();
        String sql = "UPDATE import_runs SET status=?,finished_at_ms=?,updated_at_ms=?,error_summary=?,error_details=?"
                + " WHERE run_id=? AND status=? AND " + column + "<=?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, ImportRunStatus.ROLLED_BACK.dbValue());
            ps.setLong(2, now);
            ps.setLong(3, now);
            ps.setString(4, summary);
            ps.setString(5, jsonOrNull(details));
            ps.setString(6, runId);
            ps.setString(7, expected.dbValue());
            ps.setLong(8, cutoffMs);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to roll back stale run: " + runId, e);
        }
    }

    private String staleColumn(ImportRunStatus status) {
        return switch (status) {
            case RUNNING -> "started_at_ms";
            case PENDING -> "created_at_ms";
            default -> throw new IllegalArgumentException("Only pending or running runs can be stale: " + status);
        };
    }

    private int countSince(String target, ImportRunStatus status, long sinceMs) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT COUNT(*) FROM import_runs WHERE target=? AND status=? AND created_at_ms>=?")) {
            ps.setString(1, target);
            ps.setString(2, status.dbValue());
            ps.setLong(3, sinceMs);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    private Optional<ImportRun> newestWithStatus(String target, String sha256, LocalDate asOfDate,
                                                 Set<ImportRunStatus> statuses) throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(RUN_COLUMNS)
                .append(" FROM import_runs WHERE target=? AND file_sha256=? AND as_of_date=? AND status IN (");
        List<ImportRunStatus> ordered = new ArrayList<>(statuses);
        for (int i = 0; i < ordered.size(); i++) {
            sql.append(i == 0 ? "?" : ",?");
        }
        sql.append(") ORDER BY created_at_ms DESC, rowid DESC LIMIT 1");
        try (PreparedStatement ps = connection.prepareStatement(sql.toString())) {
            ps.setString(1, target);
            ps.setString(2, sha256);
            ps.setString(3, asOfDate.toString());
            int i = 4;
            for (ImportRunStatus status : ordered) {
                ps.setString(i++, status.dbValue());
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readRun(rs)) : Optional.empty();
            }
        }
    }

    private void guardedUpdate(String runId, Set<ImportRunStatus> expected, String sql, Binder binder) {
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            binder.bind(ps);
            if (ps.executeUpdate() > 0) {
                return;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update import run: " + runId, e);
        }
        String actual = findRun(runId).map(run -> run.status().dbValue()).orElse("missing");
        throw new IllegalRunTransitionException(runId, expected, actual);
    }

    private ImportRun readRun(ResultSet rs) throws SQLException {
        Map<String, Long> metrics = new LinkedHashMap<>();
        for (String column : RunMetrics.COLUMNS) {
            long v = rs.getLong(column);
            if (!rs.wasNull()) {
                metrics.put(column, v);
            }
        }
        return new ImportRun(
                rs.getString("run_id"),
                rs.getString("target"),
                rs.getString("source_filename"),
                rs.getString("file_sha256"),
                rs.getLong("file_size_bytes"),
                rs.getString("envelope_id"),
                LocalDate.parse(rs.getString("as_of_date")),
                nullableInstant(rs, "as_of_datetime_ms"),
                ImportRunStatus.fromString(rs.getString("status")),
                rs.getString("triggered_by"),
                ProcessingMode.fromString(rs.getString("processing_mode")),
                Instant.ofEpochMilli(rs.getLong("created_at_ms")),
                Instant.ofEpochMilli(rs.getLong("updated_at_ms")),
                nullableInstant(rs, "started_at_ms"),
                nullableInstant(rs, "finished_at_ms"),
                metrics,
                rs.getString("error_summary"),
                nullableJson(rs.getString("error_details")),
                nullableJson(rs.getString("artifact_paths")),
                nullableJson(rs.getString("import_config"))
        );
    }

    private static Instant nullableInstant(ResultSet rs, String column) throws SQLException {
        long v = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochMilli(v);
    }

    private static Map<String, Object> nullableJson(String raw) {
        return raw == null ? null : Jsons.toMap(raw);
    }

    private static void setNullableInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value.toEpochMilli());
        }
    }

    private static String jsonOrNull(Map<String, ?> value) {
        return value == null ? null : Jsons.toCompactJson(value);
    }

    static boolean isUniqueViolation(SQLException e) {
        String message = e.getMessage();
        return e.getErrorCode() == SQLITE_CONSTRAINT && message != null && message.contains("UNIQUE");
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    public record NewAttempt(
            String target,
            FileFingerprint file,
            LocalDate asOfDate,
            String triggeredBy,
            Instant asOfDateTime,
            String envelopeId,
            Map<String, Object> importConfig
    ) {
        public NewAttempt {
            if (target == null || target.isBlank()) {
                throw new IllegalArgumentException("target must not be blank");
            }
            if (file == null) {
                throw new IllegalArgumentException("file fingerprint is required");
            }
            if (asOfDate == null) {
                throw new IllegalArgumentException("as_of_date is required");
            }
            triggeredBy = triggeredBy == null || triggeredBy.isBlank() ? "manual" : triggeredBy;
        }

        public NewAttempt withEnvelopeId(String id) {
            return new NewAttempt(target, file, asOfDate, triggeredBy, asOfDateTime, id, importConfig);
        }
    }

    public record StaleCandidate(String runId, ImportRunStatus status, Instant since) {
    }

    public record StalenessReport(
            String target,
            Instant lastSuccessAt,
            Double hoursSinceSuccess,
            int failedLast7d,
            int successLast7d,
            boolean currentlyRunning,
            String lastError
    ) {
    }
}
