package io.pricedock.catalog;

import io.pricedock.orchestrator.ImportContext;
import io.pricedock.orchestrator.ImportFunction;
import io.pricedock.orchestrator.ImportPayload;
import io.pricedock.quality.NumberCoercion;
import io.pricedock.quality.PriceRow;
import io.pricedock.quality.QualityGate;
import io.pricedock.quality.QualityGateRejectedException;
import io.pricedock.quality.QualityGateResult;
import io.pricedock.quality.QuarantineStore;
import io.pricedock.registry.RunMetrics;
import io.pricedock.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads a price list into {@code products} and {@code product_prices}.
 *
 * <p>Rejected rows are written to quarantine on a separate connection and committed at once,
 * so they survive even when the catalog transaction is rolled back.
 */
public final class CatalogPriceImporter implements ImportFunction {
    private static final Logger log = LoggerFactory.getLogger(CatalogPriceImporter.class);

    private final Database database;
    private final PriceListReader reader;
    private final QuarantineStore quarantineStore;
    private final Clock clock;

    public CatalogPriceImporter(Database database) {
        this(database, new CsvPriceListReader(), new QuarantineStore(), Clock.systemUTC());
    }

    public CatalogPriceImporter(Database database, PriceListReader reader, QuarantineStore quarantineStore,
                                Clock clock) {
        this.database = database;
        this.reader = reader;
        this.quarantineStore = quarantineStore;
        this.clock = clock;
    }

    @Override
    public ImportPayload importFile(Connection connection, ImportContext context) throws Exception {
        List<PriceRow> rows = reader.read(context.filePath());
        if (rows.isEmpty()) {
            throw new IllegalStateException("Price list contains no data rows: " + context.filePath().getFileName());
        }
        QualityGateResult gate = QualityGate.apply(rows);
        int quarantined = persistQuarantine(context, gate);
        if (gate.accepted().isEmpty()) {
            throw new QualityGateRejectedException(quarantined);
        }

        long now = clock.millis();
        int newSkus = 0;
        int updatedSkus = 0;
        int skipped = 0;
        Set<String> seenCodes = new HashSet<>();
        Set<String> newProducers = new HashSet<>();
        Set<String> knownProducers = new HashSet<>();
        for (PriceRow row : gate.accepted()) {
            String code = row.text(PriceRow.CODE);
            if (!seenCodes.add(code)) {
                skipped++;
                continue;
            }
            String producer = row.text(PriceRow.PRODUCER);
            if (producer != null && !knownProducers.contains(producer) && !newProducers.contains(producer)) {
                if (producerExists(connection, producer)) {
                    knownProducers.add(producer);
                } else {
                    newProducers.add(producer);
                }
            }
            if (productExists(connection, code)) {
                updatedSkus++;
            } else {
                newSkus++;
            }
            upsertProduct(connection, row, code, now);
            upsertPrice(connection, row, code, context, now);
        }
        if (skipped > 0) {
            log.warn("skipped {} duplicate codes in file={}", skipped, context.filePath().getFileName());
        }

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put(RunMetrics.TOTAL_ROWS_PROCESSED, rows.size());
        metrics.put(RunMetrics.NEW_SKU_COUNT, newSkus);
        metrics.put(RunMetrics.UPDATED_SKU_COUNT, updatedSkus);
        metrics.put(RunMetrics.NEW_WINERY_COUNT, newProducers.size());
        metrics.put(RunMetrics.QUARANTINE_COUNT, quarantined);
        metrics.put(RunMetrics.ROWS_SKIPPED, skipped);
        return new ImportPayload(metrics, Map.of("source_file", context.filePath().toString()));
    }

    private int persistQuarantine(ImportContext context, QualityGateResult gate) throws SQLException {
        if (gate.rejected().isEmpty()) {
            return 0;
        }
        try (Connection q = database.openConnection()) {
            q.setAutoCommit(false);
            try {
                int n = quarantineStore.persist(q, context.runId(), context.envelopeId(), gate.rejected());
                q.commit();
                log.warn("quarantined {} of {} rows run_id={}", n, gate.total(), context.runId());
                return n;
            } catch (Exception e) {
                q.rollback();
                throw e;
            } finally {
                q.setAutoCommit(true);
            }
        }
    }

    private boolean productExists(Connection c, String code) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM products WHERE code=?")) {
            ps.setString(1, code);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private boolean producerExists(Connection c, String producer) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM products WHERE producer=? LIMIT 1")) {
            ps.setString(1, producer);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void upsertProduct(Connection c, PriceRow row, String code, long now) throws SQLException {
        String sql = """
                INSERT INTO products(code,title,producer,country,region,volume,abv,created_at_ms,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                ON CONFLICT(code) DO UPDATE SET
                    title=COALESCE(excluded.title, products.title),
                    producer=COALESCE(excluded.producer, products.producer),
                    country=COALESCE(excluded.country, products.country),
                    region=COALESCE(excluded.region, products.region),
                    volume=COALESCE(excluded.volume, products.volume),
                    abv=COALESCE(excluded.abv, products.abv),
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, code);
            ps.setString(2, row.text(PriceRow.TITLE));
            ps.setString(3, row.text(PriceRow.PRODUCER));
            ps.setString(4, row.text(PriceRow.COUNTRY));
            ps.setString(5, row.text(PriceRow.REGION));
            setDouble(ps, 6, NumberCoercion.toDouble(row.get(PriceRow.VOLUME)));
            setDouble(ps, 7, NumberCoercion.toDouble(row.get(PriceRow.ABV)));
            ps.setLong(8, now);
            ps.setLong(9, now);
            ps.executeUpdate();
        }
    }

    private void upsertPrice(Connection c, PriceRow row, String code, ImportContext context, long now)
            throws SQLException {
        String sql = """
                INSERT INTO product_prices(code,as_of_date,price_list,price_discount,stock_total,reserved,stock_free,run_id,updated_at_ms)
                VALUES(?,?,?,?,?,?,?,?,?)
                ON CONFLICT(code, as_of_date) DO UPDATE SET
                    price_list=excluded.price_list,
                    price_discount=excluded.price_discount,
                    stock_total=excluded.stock_total,
                    reserved=excluded.reserved,
                    stock_free=excluded.stock_free,
                    run_id=excluded.run_id,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, code);
            ps.setString(2, context.asOfDate().toString());
            setDouble(ps, 3, NumberCoercion.toDouble(row.get(PriceRow.PRICE_LIST)));
            setDouble(ps, 4, NumberCoercion.toDouble(row.get(PriceRow.PRICE_DISCOUNT)));
            setLong(ps, 5, NumberCoercion.toLong(row.get(PriceRow.STOCK_TOTAL)));
            setLong(ps, 6, NumberCoercion.toLong(row.get(PriceRow.RESERVED)));
            setLong(ps, 7, NumberCoercion.toLong(row.get(PriceRow.STOCK_FREE)));
            ps.setString(8, context.runId());
            ps.setLong(9, now);
            ps.executeUpdate();
        }
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, value);
        }
    }
}
