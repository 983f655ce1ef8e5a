package io.pricedock.catalog;

import io.pricedock.config.PriceDockConfig;
import io.pricedock.orchestrator.ImportContext;
import io.pricedock.orchestrator.ImportPayload;
import io.pricedock.quality.QualityGateRejectedException;
import io.pricedock.quality.QuarantineStore;
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
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

final class CatalogPriceImporterTest {
    private static final LocalDate AS_OF = LocalDate.of(2026, 3, 1);

    @Test
    void upsertsProductsAndPricesAndCountsMetrics() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-catalog-");
        try {
            Database db = initDb(root);
            Path file = root.resolve("prices.csv");
            Files.writeString(file, """
                    code;title;producer;price;stock;abv
                    SKU-001;Wine A;Chateau X;1 234,50;10;13,5
                    SKU-002;Wine B;Chateau X;99;5;12
                    SKU-002;Wine B dup;Chateau X;98;5;12
                    SKU-003;Bad;Chateau Y;10;-1;12
                    """, StandardCharsets.UTF_8);
            CatalogPriceImporter importer = new CatalogPriceImporter(db);

            ImportPayload payload;
            try (Connection c = db.openConnection()) {
                c.setAutoCommit(false);
                payload = importer.importFile(c, context(file, "run-1"));
                c.commit();
            }
            Assertions.assertEquals(4, payload.metrics().get(RunMetrics.TOTAL_ROWS_PROCESSED));
            Assertions.assertEquals(2, payload.metrics().get(RunMetrics.NEW_SKU_COUNT));
            Assertions.assertEquals(0, payload.metrics().get(RunMetrics.UPDATED_SKU_COUNT));
            Assertions.assertEquals(1, payload.metrics().get(RunMetrics.NEW_WINERY_COUNT));
            Assertions.assertEquals(1, payload.metrics().get(RunMetrics.QUARANTINE_COUNT));
            Assertions.assertEquals(1, payload.metrics().get(RunMetrics.ROWS_SKIPPED));
            Assertions.assertEquals(file.toString(), payload.artifacts().get("source_file"));

            try (Connection c = db.openConnection()) {
                Assertions.assertEquals(1234.5d, price(c, "SKU-001"));
                Assertions.assertEquals(1, new QuarantineStore().listByRun(c, "run-1").size());
            }

            try (Connection c = db.openConnection()) {
                c.setAutoCommit(false);
                ImportPayload again = importer.importFile(c, context(file, "run-2"));
                c.commit();
                Assertions.assertEquals(0, again.metrics().get(RunMetrics.NEW_SKU_COUNT));
                Assertions.assertEquals(2, again.metrics().get(RunMetrics.UPDATED_SKU_COUNT));
                Assertions.assertEquals(0, again.metrics().get(RunMetrics.NEW_WINERY_COUNT));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void allRowsRejectedThrowsButKeepsQuarantine() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-catalog-");
        try {
            Database db = initDb(root);
            Path file = root.resolve("bad.csv");
            Files.writeString(file, "code;price\nx;1\nSKU-9;-5\n", StandardCharsets.UTF_8);
            try (Connection c = db.openConnection()) {
                c.setAutoCommit(false);
                QualityGateRejectedException e = Assertions.assertThrows(QualityGateRejectedException.class,
                        () -> new CatalogPriceImporter(db).importFile(c, context(file, "run-bad")));
                c.rollback();
                Assertions.assertTrue(e.getMessage().contains("2"));
            }
            try (Connection c = db.openConnection()) {
                Assertions.assertEquals(2, new QuarantineStore().listByRun(c, "run-bad").size());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void emptyFileIsAnError() throws Exception {
        Path root = Files.createTempDirectory("pricedock-test-catalog-");
        try {
            Database db = initDb(root);
            Path file = root.resolve("empty.csv");
            Files.writeString(file, "code;price\n", StandardCharsets.UTF_8);
            try (Connection c = db.openConnection()) {
                Assertions.assertThrows(IllegalStateException.class,
                        () -> new CatalogPriceImporter(db).importFile(c, context(file, "run-empty")));
            }
        } finally {
            deleteRecursively(root);
        }
    }

    private static ImportContext context(Path file, String runId) {
        return new ImportContext("primary", file, AS_OF, runId, null, Map.of());
    }

    private static double price(Connection c, String code) throws Exception {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT price_list FROM product_prices WHERE code=? AND as_of_date=?")) {
            ps.setString(1, code);
            ps.setString(2, AS_OF.toString());
            try (ResultSet rs = ps.executeQuery()) {
                Assertions.assertTrue(rs.next());
                return rs.getDouble(1);
            }
        }
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
