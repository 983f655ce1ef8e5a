package io.pricedock.orchestrator;

import io.pricedock.config.PriceDockConfig;
import io.pricedock.model.ImportRun;
import io.pricedock.model.ImportRunStatus;
import io.pricedock.registry.ImportRunRegistry;
import io.pricedock.registry.RunMetrics;
import io.pricedock.storage.Database;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class ImportOrchestratorTest {
    private static final LocalDate AS_OF = LocalDate.of(2026, 3, 1);

    @Test
    void duplicateFileIsSkippedAndNewContentProceeds() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-orchestrator-");
        try {
            Database db = initDb(root);
            ImportOrchestrator orchestrator = new ImportOrchestrator(db);
            AtomicInteger calls = new AtomicInteger();
            ImportFunction fn = (c, ctx) -> {
                calls.incrementAndGet();
                return ImportPayload.ofMetrics(Map.of(RunMetrics.TOTAL_ROWS_PROCESSED, 5));
            };

            Path h1 = write(root, "prices.csv", "code;price\nA100;1\n");
            OrchestratorResult first = orchestrator.run(ImportRequest.of("primary", h1, AS_OF, "test"), fn);
            Assertions.assertEquals(OrchestratorResult.Status.SUCCESS, first.status());
            Assertions.assertNotNull(first.runId());
            Assertions.assertNotNull(first.envelopeId());
            Assertions.assertEquals(5L, first.metric(RunMetrics.TOTAL_ROWS_PROCESSED));

            OrchestratorResult again = orchestrator.run(ImportRequest.of("primary", h1, AS_OF, "test"), fn);
            Assertions.assertEquals(OrchestratorResult.Status.SKIPPED, again.status());
            Assertions.assertTrue(again.reason().startsWith("SKIP_ALREADY_SUCCESS"));
            Assertions.assertTrue(again.reason().contains(first.runId()));
            Assertions.assertEquals(1, calls.get());

            Path h2 = write(root, "prices.csv", "code;price\nA100;2\n");
            OrchestratorResult changed = orchestrator.run(ImportRequest.of("primary", h2, AS_OF, "test"), fn);
            Assertions.assertEquals(OrchestratorResult.Status.SUCCESS, changed.status());
            Assertions.assertEquals(2, calls.get());

            try (Connection c = db.openConnection()) {
                ImportRunRegistry registry = new ImportRunRegistry(c);
                ImportRun run = registry.findRun(first.runId()).orElseThrow();
                Assertions.assertEquals(ImportRunStatus.SUCCESS, run.status());
                Assertions.assertEquals(first.envelopeId(), run.envelopeId());
                Assertions.assertNotNull(run.startedAt());
                Assertions.assertEquals(1, registry.listRecent(10, "primary", ImportRunStatus.SKIPPED).size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failureIsRecordedAndRetryIsAccepted() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-orchestrator-");
        try {
            Database db = initDb(root);
            ImportOrchestrator orchestrator = new ImportOrchestrator(db);
            Path file = write(root, "prices.csv", "code;price\nA100;1\n");

            OrchestratorResult failed = orchestrator.run(ImportRequest.of("primary", file, AS_OF, "test"), (c, ctx) -> {
                insertProduct(c, "ROLLED-BACK");
                throw new IllegalStateException("parser exploded");
            });
            Assertions.assertEquals(OrchestratorResult.Status.FAILED, failed.status());
            Assertions.assertNotNull(failed.runId());
            Assertions.assertEquals("parser exploded", failed.reason());
            Assertions.assertEquals("IllegalStateException", failed.errorType());

            try (Connection c = db.openConnection()) {
                ImportRun run = new ImportRunRegistry(c).findRun(failed.runId()).orElseThrow();
                Assertions.assertEquals(ImportRunStatus.FAILED, run.status());
                Assertions.assertEquals("parser exploded", run.errorSummary());
                Assertions.assertEquals("IllegalStateException", run.errorDetails().get("type"));
                Assertions.assertEquals(0, countProducts(c));
            }

            OrchestratorResult retry = orchestrator.run(ImportRequest.of("primary", file, AS_OF, "test"), (c, ctx) -> {
                insertProduct(c, "COMMITTED");
                return ImportPayload.empty();
            });
            Assertions.assertEquals(OrchestratorResult.Status.SUCCESS, retry.status());
            Assertions.assertNotEquals(failed.runId(), retry.runId());
            try (Connection c = db.openConnection()) {
                Assertions.assertEquals(1, countProducts(c));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingEnvelopeTableDoesNotBlockImport() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-orchestrator-");
        try {
            Database db = initDb(root);
            try (Connection c = db.openConnection(); Statement st = c.createStatement()) {
                st.execute("DROP TABLE ingest_envelope");
            }
            Path file = write(root, "prices.csv", "code;price\nA100;1\n");
            OrchestratorResult result = new ImportOrchestrator(db)
                    .run(ImportRequest.of("primary", file, AS_OF, "test"), (c, ctx) -> {
                        Assertions.assertNull(ctx.envelopeId());
                        return ImportPayload.empty();
                    });
            Assertions.assertEquals(OrchestratorResult.Status.SUCCESS, result.status());
            Assertions.assertNull(result.envelopeId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingFileFailsWithoutRegistering() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-orchestrator-");
        try {
            Database db = initDb(root);
            OrchestratorResult result = new ImportOrchestrator(db).run(
                    ImportRequest.of("primary", root.resolve("nope.csv"), AS_OF, "test"),
                    (c, ctx) -> ImportPayload.empty()
            );
            Assertions.assertEquals(OrchestratorResult.Status.FAILED, result.status());
            Assertions.assertNull(result.runId());
            try (Connection c = db.openConnection()) {
                Assertions.assertTrue(new ImportRunRegistry(c).listRecent(10, null, null).isEmpty());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentSameFileRunsImportOnce() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-orchestrator-");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Database db = initDb(root);
            Path file = write(root, "prices.csv", "code;price\nA100;1\n");
            AtomicInteger calls = new AtomicInteger();
            ImportFunction slow = (c, ctx) -> {
                calls.incrementAndGet();
                Thread.sleep(300);
                return ImportPayload.empty();
            };
            CountDownLatch go = new CountDownLatch(1);
            List<Future<OrchestratorResult>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    go.await(5, TimeUnit.SECONDS);
                    return new ImportOrchestrator(db).run(ImportRequest.of("primary", file, AS_OF, "test"), slow);
                }));
            }
            go.countDown();
            int success = 0;
            int skipped = 0;
            for (Future<OrchestratorResult> f : futures) {
                OrchestratorResult r = f.get(30, TimeUnit.SECONDS);
                if (r.status() == OrchestratorResult.Status.SUCCESS) {
                    success++;
                } else if (r.status() == OrchestratorResult.Status.SKIPPED) {
                    skipped++;
                }
            }
            Assertions.assertEquals(1, success);
            Assertions.assertEquals(1, skipped);
            Assertions.assertEquals(1, calls.get());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static void insertProduct(Connection c, String code) throws Exception {
        try (PreparedStatement ps = c.prepareStatement(
                "INSERT INTO products(code,created_at_ms,updated_at_ms) VALUES(?,0,0)")) {
            ps.setString(1, code);
            ps.executeUpdate();
        }
    }

    private static int countProducts(Connection c) throws Exception {
        try (Statement st = c.createStatement(); ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM products")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static Path write(Path root, String name, String content) throws IOException {
        Path file = root.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private static Database initDb(Path root) {
        Database db = new Database(PriceDockConfig.fromRoot(root.toString()));
        db.init();
        return db;
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
