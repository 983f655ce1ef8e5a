package io.pricedock.registry;

import io.pricedock.config.PriceDockConfig;
import io.pricedock.ingest.FileFingerprint;
import io.pricedock.model.ImportRun;
import io.pricedock.model.ImportRunStatus;
import io.pricedock.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

final class StaleRunReaperTest {
    private static final Instant T0 = Instant.parse("2026-03-01T06:00:00Z");

    @Test
    void rollsBackStaleRunningAndPendingOnce() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-reaper-");
        try {
            Database db = new Database(PriceDockConfig.fromRoot(root.toString()));
            db.init();
            String running;
            String pending;
            String fresh;
            try (Connection c = db.openConnection()) {
                ImportRunRegistry old = new ImportRunRegistry(c, null, Clock.fixed(T0, ZoneOffset.UTC));
                running = old.createAttempt(attempt("h-running"));
                old.markRunning(running);
                pending = old.createAttempt(attempt("h-pending"));

                ImportRunRegistry recent = new ImportRunRegistry(c, null,
                        Clock.fixed(T0.plus(Duration.ofMinutes(170)), ZoneOffset.UTC));
                fresh = recent.createAttempt(attempt("h-fresh"));
                recent.markRunning(fresh);
            }

            Clock now = Clock.fixed(T0.plus(Duration.ofHours(3)), ZoneOffset.UTC);
            StaleRunReaper reaper = new StaleRunReaper(db, Duration.ofMinutes(120), Duration.ofMinutes(15), now);
            StaleRunReaper.ReapSummary first = reaper.reap();
            Assertions.assertEquals(1, first.rolledBackRunning());
            Assertions.assertEquals(1, first.rolledBackPending());
            Assertions.assertEquals(2, first.total());
            Assertions.assertEquals(running, first.runningRunIds().get(0));
            Assertions.assertEquals(pending, first.pendingRunIds().get(0));

            StaleRunReaper.ReapSummary second = reaper.reap();
            Assertions.assertEquals(0, second.total());

            try (Connection c = db.openConnection()) {
                ImportRunRegistry registry = new ImportRunRegistry(c);
                ImportRun reapedRunning = registry.findRun(running).orElseThrow();
                Assertions.assertEquals(ImportRunStatus.ROLLED_BACK, reapedRunning.status());
                Assertions.assertEquals(StaleRunReaper.RUNNING_SUMMARY, reapedRunning.errorSummary());
                Assertions.assertEquals("stale_running", reapedRunning.errorDetails().get("reason"));
                ImportRun reapedPending = registry.findRun(pending).orElseThrow();
                Assertions.assertEquals(ImportRunStatus.ROLLED_BACK, reapedPending.status());
                Assertions.assertEquals(StaleRunReaper.PENDING_SUMMARY, reapedPending.errorSummary());
                Assertions.assertEquals(ImportRunStatus.RUNNING, registry.findRun(fresh).orElseThrow().status());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reapedKeyAcceptsNewAttempt() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-reaper-");
        try {
            Database db = new Database(PriceDockConfig.fromRoot(root.toString()));
            db.init();
            try (Connection c = db.openConnection()) {
                ImportRunRegistry old = new ImportRunRegistry(c, null, Clock.fixed(T0, ZoneOffset.UTC));
                String stuck = old.createAttempt(attempt("h1"));
                old.markRunning(stuck);
            }
            Clock later = Clock.fixed(T0.plus(Duration.ofHours(5)), ZoneOffset.UTC);
            new StaleRunReaper(db, Duration.ofMinutes(120), Duration.ofMinutes(15), later).reap();
            try (Connection c = db.openConnection()) {
                ImportRunRegistry registry = new ImportRunRegistry(c, null, later);
                Assertions.assertNotNull(registry.createAttempt(attempt("h1")));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void negativeGraceIsRejected() {
        Database db = new Database(PriceDockConfig.fromRoot("unused"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new StaleRunReaper(db, Duration.ofMinutes(-1), Duration.ZERO, Clock.systemUTC()));
    }

    private static ImportRunRegistry.NewAttempt attempt(String sha) {
        return new ImportRunRegistry.NewAttempt("primary", new FileFingerprint(sha, 1L, "p.csv"),
                LocalDate.of(2026, 3, 1), "test", null, null, Map.of());
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.comparingInt(Path::getNameCount).reversed())
                    .forEach(p -> {
                        try {
                            Files.deleteIfExists(p);
                        } catch (IOException ignored) {
                        }
                    });
        }
    }
}
