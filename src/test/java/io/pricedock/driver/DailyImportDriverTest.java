package io.pricedock.driver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.catalog.CatalogPriceImporter;
import io.pricedock.config.IngestSettings;
import io.pricedock.config.PriceDockConfig;
import io.pricedock.lock.FileNamedLock;
import io.pricedock.model.ImportMode;
import io.pricedock.storage.Database;
import io.pricedock.supervisor.StatusDocuments;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

final class DailyImportDriverTest {
    private static final String GOOD_CSV = """
            code;title;producer;price;stock
            SKU-001;Wine A;Chateau X;1 234,50;10
            SKU-002;Wine B;Chateau Y;99;5
            """;
    private static final String BAD_CSV = """
            code;price;stock
            SKU-001;10;-1
            x;5;1
            """;

    @Test
    void emptyInboxIsOkWithSkips() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-driver-");
        try {
            Fixture f = fixture(root);
            ObjectNode doc = f.driver.run("run-empty", ImportMode.AUTO, List.of(), null);
            Assertions.assertEquals("OK_WITH_SKIPS", doc.get(StatusDocuments.STATUS).asText());
            Assertions.assertEquals("AUTO_INBOX_NEWEST", doc.get(StatusDocuments.SELECTED_MODE).asText());
            JsonNode file = doc.get(StatusDocuments.FILES).get(0);
            Assertions.assertEquals("SKIPPED", file.get("status").asText());
            Assertions.assertEquals("NO_FILES_IN_INBOX", file.get("skip_reason").asText());
            Assertions.assertEquals("No files in inbox", doc.get(StatusDocuments.SUMMARY).get("notes").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void importsArchivesAndSkipsSameContentLater() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-driver-");
        try {
            Fixture f = fixture(root);
            drop(f.config, "prices_2026-03-01.csv", GOOD_CSV);

            ObjectNode first = f.driver.run("run-1", ImportMode.AUTO, List.of(), "primary");
            Assertions.assertEquals("OK", first.get(StatusDocuments.STATUS).asText());
            JsonNode imported = first.get(StatusDocuments.FILES).get(0);
            Assertions.assertEquals("IMPORTED", imported.get("status").asText());
            Assertions.assertEquals("2026-03-01", imported.get("effective_date").asText());
            Assertions.assertEquals(2, imported.get("rows_good").asInt());
            Assertions.assertTrue(imported.get("archive_path").asText().startsWith("archive/"));
            Assertions.assertTrue(Files.exists(f.config.rootDir().resolve(imported.get("archive_path").asText())));
            Assertions.assertFalse(Files.exists(f.config.inboxDir().resolve("prices_2026-03-01.csv")));
            Assertions.assertEquals(2, first.get(StatusDocuments.SUMMARY).get("rows_good_total").asInt());

            drop(f.config, "prices_2026-03-01.csv", GOOD_CSV);
            ObjectNode second = f.driver.run("run-2", ImportMode.FILES, List.of("prices_2026-03-01.csv"), "primary");
            Assertions.assertEquals("OK_WITH_SKIPS", second.get(StatusDocuments.STATUS).asText());
            Assertions.assertEquals("MANUAL_LIST", second.get(StatusDocuments.SELECTED_MODE).asText());
            JsonNode skipped = second.get(StatusDocuments.FILES).get(0);
            Assertions.assertEquals("SKIPPED", skipped.get("status").asText());
            Assertions.assertEquals("ALREADY_IMPORTED_SAME_HASH", skipped.get("skip_reason").asText());
            Assertions.assertFalse(skipped.get("archive_path").isNull());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sameNameArchivedTwiceInOneSecondKeepsBothFiles() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-driver-");
        try {
            Clock fixed = Clock.fixed(Instant.parse("2026-03-01T06:00:00Z"), ZoneOffset.UTC);
            Fixture f = fixture(root, fixed);
            drop(f.config, "prices_2026-03-01.csv", GOOD_CSV);
            ObjectNode first = f.driver.run("run-a", ImportMode.AUTO, List.of(), "primary");
            drop(f.config, "prices_2026-03-01.csv", GOOD_CSV + "SKU-003;Wine C;Chateau Z;50;2\n");
            ObjectNode second = f.driver.run("run-b", ImportMode.AUTO, List.of(), "primary");

            String firstPath = first.get(StatusDocuments.FILES).get(0).get("archive_path").asText();
            String secondPath = second.get(StatusDocuments.FILES).get(0).get("archive_path").asText();
            Assertions.assertEquals("archive/2026-03/20260301-060000_prices_2026-03-01.csv", firstPath);
            Assertions.assertEquals("archive/2026-03/20260301-060000_prices_2026-03-01__1.csv", secondPath);
            Assertions.assertEquals(GOOD_CSV, Files.readString(f.config.rootDir().resolve(firstPath)));
            Assertions.assertTrue(Files.readString(f.config.rootDir().resolve(secondPath)).contains("SKU-003"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fullyRejectedFileIsQuarantined() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-driver-");
        try {
            Fixture f = fixture(root);
            drop(f.config, "bad_2026-03-01.csv", BAD_CSV);
            ObjectNode doc = f.driver.run("run-bad", ImportMode.FILES, List.of("bad_2026-03-01.csv"), null);
            Assertions.assertEquals("OK_WITH_SKIPS", doc.get(StatusDocuments.STATUS).asText());
            JsonNode file = doc.get(StatusDocuments.FILES).get(0);
            Assertions.assertEquals("QUARANTINED", file.get("status").asText());
            Assertions.assertEquals(2, file.get("rows_quarantine").asInt());
            Assertions.assertTrue(file.get("quarantine_path").asText().startsWith("quarantine/"));
            Assertions.assertEquals(1, doc.get(StatusDocuments.SUMMARY).get("files_quarantined").asInt());
            Assertions.assertEquals(2, doc.get(StatusDocuments.SUMMARY).get("rows_quarantine_total").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidEntriesAreReportedPerFile() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-driver-");
        try {
            Fixture f = fixture(root);
            drop(f.config, "prices_2026-03-01.csv", GOOD_CSV);
            ObjectNode doc = f.driver.run("run-mixed", ImportMode.FILES,
                    List.of("prices_2026-03-01.csv", "notes.txt", "../pricedock.db.csv"), null);
            Assertions.assertEquals("FAILED", doc.get(StatusDocuments.STATUS).asText());
            JsonNode summary = doc.get(StatusDocuments.SUMMARY);
            Assertions.assertEquals(3, summary.get("files_total").asInt());
            Assertions.assertEquals(1, summary.get("files_imported").asInt());
            Assertions.assertEquals(1, summary.get("files_skipped").asInt());
            Assertions.assertEquals(1, summary.get("files_failed").asInt());
            Assertions.assertEquals("INVALID_EXTENSION", doc.get(StatusDocuments.FILES).get(1).get("skip_reason").asText());
            Assertions.assertTrue(doc.get(StatusDocuments.FILES).get(2).get("error").asText().contains("traversal"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void filesModeWithoutFilesFails() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-driver-");
        try {
            Fixture f = fixture(root);
            ObjectNode doc = f.driver.run("run-nofiles", ImportMode.FILES, List.of(), null);
            Assertions.assertEquals("FAILED", doc.get(StatusDocuments.STATUS).asText());
            Assertions.assertEquals(0, doc.get(StatusDocuments.FILES).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void heldLockYieldsFailedDocument() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-driver-");
        try {
            Fixture f = fixture(root);
            drop(f.config, "prices_2026-03-01.csv", GOOD_CSV);
            try (FileNamedLock held = new FileNamedLock(f.config.locksDir(), f.settings.lockName())) {
                Assertions.assertTrue(held.tryAcquire());
                ObjectNode doc = f.driver.run("run-locked", ImportMode.AUTO, List.of(), null);
                Assertions.assertEquals("FAILED", doc.get(StatusDocuments.STATUS).asText());
                Assertions.assertTrue(doc.get(StatusDocuments.ERROR).asText().contains(f.settings.lockName()));
            }
            Assertions.assertTrue(Files.exists(f.config.inboxDir().resolve("prices_2026-03-01.csv")));
        } finally {
            deleteRecursively(root);
        }
    }

    private record Fixture(PriceDockConfig config, IngestSettings settings, DailyImportDriver driver) {
    }

    private static Fixture fixture(Path root) {
        return fixture(root, Clock.systemUTC());
    }

    private static Fixture fixture(Path root, Clock clock) {
        PriceDockConfig config = PriceDockConfig.fromRoot(root.toString());
        IngestSettings settings = IngestSettings.defaults();
        Database db = new Database(config);
        db.init();
        DailyImportDriver driver = new DailyImportDriver(config, settings, db, new CatalogPriceImporter(db), clock);
        return new Fixture(config, settings, driver);
    }

    private static void drop(PriceDockConfig config, String name, String content) throws IOException {
        Files.writeString(config.inboxDir().resolve(name), content, StandardCharsets.UTF_8);
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
