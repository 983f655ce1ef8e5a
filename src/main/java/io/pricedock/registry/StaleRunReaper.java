package io.pricedock.registry;

import io.pricedock.model.ImportRunStatus;
import io.pricedock.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts runs stuck in {@code running} or {@code pending} past their grace period into
 * {@code rolled_back}, which unblocks their key for a retry. Each run is updated in its
 * own transaction with a status guard, so overlapping sweeps never double count.
 */
public final class StaleRunReaper {
    public static final String RUNNING_SUMMARY = "Stale run: timeout / crashed importer";
    public static final String PENDING_SUMMARY = "Stale run: never started (stuck pending)";
    private static final int SCAN_LIMIT = 500;
    private static final Logger log = LoggerFactory.getLogger(StaleRunReaper.class);

    private final Database database;
    private final Duration runningGrace;
    private final Duration pendingGrace;
    private final Clock clock;

    public StaleRunReaper(Database database, Duration runningGrace, Duration pendingGrace, Clock clock) {
        if (runningGrace.isNegative() || pendingGrace.isNegative()) {
            throw new IllegalArgumentException("grace periods must not be negative");
        }
        this.database = database;
        this.runningGrace = runningGrace;
        this.pendingGrace = pendingGrace;
        this.clock = clock;
    }

    public ReapSummary reap() {
        long now = clock.millis();
        long runningCutoff = now - runningGrace.toMillis();
        long pendingCutoff = now - pendingGrace.toMillis();
        List<String> running = reapStatus(ImportRunStatus.RUNNING, runningCutoff, RUNNING_SUMMARY, runningGrace);
        List<String> pending = reapStatus(ImportRunStatus.PENDING, pendingCutoff, PENDING_SUMMARY, pendingGrace);
        return new ReapSummary(running.size(), pending.size(), running, pending);
    }

    private List<String> reapStatus(ImportRunStatus status, long cutoffMs, String summary, Duration grace) {
        List<ImportRunRegistry.StaleCandidate> candidates;
        try (Connection c = database.openConnection()) {
            candidates = new ImportRunRegistry(c, null, clock).findStaleCandidates(status, cutoffMs, SCAN_LIMIT);
        } catch (SQLException e) {
            throw new RuntimeException("Failed stale run scan", e);
        }

        List<String> reaped = new ArrayList<>();
        for (ImportRunRegistry.StaleCandidate cnd : candidates) {
            try (Connection c = database.openConnection()) {
                c.setAutoCommit(false);
                try {
                    ImportRunRegistry registry = new ImportRunRegistry(c, null, clock);
                    boolean updated = registry.rollBackIfStale(
                            cnd.runId(),
                            status,
                            cutoffMs,
                            summary,
                            Map.of(
                                    "reason", "stale_" + status.dbValue(),
                                    "since", cnd.since().toString(),
                                    "grace_minutes", grace.toMinutes()
                            )
                    );
                    c.commit();
                    if (updated) {
                        reaped.add(cnd.runId());
                        log.warn("stale import run rolled back run_id={} previous_status={} since={}",
                                cnd.runId(), status.dbValue(), cnd.since());
                    }
                } catch (Exception ex) {
                    c.rollback();
                    throw ex;
                } finally {
                    c.setAutoCommit(true);
                }
            } catch (Exception e) {
                throw new RuntimeException("Failed stale run rollback: " + cnd.runId(), e);
            }
        }
        return reaped;
    }

    public record ReapSummary(
            int rolledBackRunning,
            int rolledBackPending,
            List<String> runningRunIds,
            List<String> pendingRunIds
    ) {
        public int total() {
            return rolledBackRunning + rolledBackPending;
        }
    }
}
