package io.pricedock.storage;

import io.pricedock.config.PriceDockConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "pricedock.schema.migration.v1";
    private final PriceDockConfig config;
    private final String jdbcUrl;
    private final int busyTimeoutMs;

    public Database(PriceDockConfig config) {
        this(config, PriceDockConfig.DEFAULT_BUSY_TIMEOUT_MS);
    }

    public Database(PriceDockConfig config, int busyTimeoutMs) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        this.busyTimeoutMs = Math.max(0, busyTimeoutMs);
    }

    public PriceDockConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    /**
     * Every connection waits on a locked database instead of failing fast, so concurrent
     * writers serialize on the file lock and the unique indexes decide races.
     */
    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(busyTimeoutMs));
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.inboxDir());
            Files.createDirectories(config.archiveDir());
            Files.createDirectories(config.quarantineDir());
            Files.createDirectories(config.statusDir());
            Files.createDirectories(config.locksDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS import_runs (
                        run_id TEXT PRIMARY KEY,
                        target TEXT NOT NULL,
                        source_filename TEXT NOT NULL,
                        file_sha256 TEXT NOT NULL,
                        file_size_bytes INTEGER NOT NULL DEFAULT 0,
                        envelope_id TEXT,
                        as_of_date TEXT NOT NULL,
                        as_of_datetime_ms INTEGER,
                        status TEXT NOT NULL,
                        triggered_by TEXT NOT NULL DEFAULT 'manual',
                        processing_mode TEXT NOT NULL DEFAULT 'atomic',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        finished_at_ms INTEGER,
                        total_rows_processed INTEGER,
                        new_sku_count INTEGER,
                        updated_sku_count INTEGER,
                        new_winery_count INTEGER,
                        quarantine_count INTEGER,
                        rows_skipped INTEGER,
                        error_summary TEXT,
                        error_details TEXT,
                        artifact_paths TEXT,
                        import_config TEXT
                    )
                    """);
            ensureImportRunColumns(conn);
            st.execute("""
                    CREATE UNIQUE INDEX IF NOT EXISTS ux_import_runs_blocking_key
                    ON import_runs(target, file_sha256, as_of_date)
                    WHERE status IN ('pending','running','success')
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_import_runs_key_created ON import_runs(target, file_sha256, as_of_date, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_import_runs_status_created ON import_runs(status, created_at_ms)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS ingest_envelope (
                        envelope_id TEXT PRIMARY KEY,
                        target TEXT NOT NULL,
                        source_filename TEXT NOT NULL,
                        file_sha256 TEXT NOT NULL,
                        file_size_bytes INTEGER,
                        as_of_date TEXT,
                        as_of_datetime_ms INTEGER,
                        metadata TEXT,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS price_list_quarantine (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        run_id TEXT,
                        envelope_id TEXT,
                        code TEXT,
                        raw_row TEXT NOT NULL,
                        dq_errors TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_price_list_quarantine_run ON price_list_quarantine(run_id)");
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_price_list_quarantine_no_update
                    BEFORE UPDATE ON price_list_quarantine
                    BEGIN
                        SELECT RAISE(ABORT, 'price_list_quarantine is append-only');
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_price_list_quarantine_no_delete
                    BEFORE DELETE ON price_list_quarantine
                    BEGIN
                        SELECT RAISE(ABORT, 'price_list_quarantine is append-only');
                    END
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS products (
                        code TEXT PRIMARY KEY,
                        title TEXT,
                        producer TEXT,
                        country TEXT,
                        region TEXT,
                        volume REAL,
                        abv REAL,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS product_prices (
                        code TEXT NOT NULL,
                        as_of_date TEXT NOT NULL,
                        price_list REAL,
                        price_discount REAL,
                        stock_total INTEGER,
                        reserved INTEGER,
                        stock_free INTEGER,
                        run_id TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(code, as_of_date),
                        FOREIGN KEY(code) REFERENCES products(code)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS supervised_runs (
                        run_id TEXT PRIMARY KEY,
                        requested_mode TEXT,
                        selected_mode TEXT,
                        status TEXT NOT NULL,
                        started_at_ms INTEGER,
                        finished_at_ms INTEGER,
                        duration_ms INTEGER,
                        summary TEXT,
                        result_json TEXT,
                        log_relpath TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_supervised_runs_started ON supervised_runs(started_at_ms)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
            applyMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void ensureImportRunColumns(Connection conn) throws SQLException {
        Set<String> cols = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(import_runs)")) {
            while (rs.next()) {
                cols.add(rs.getString("name"));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!cols.contains("artifact_paths")) {
                st.execute("ALTER TABLE import_runs ADD COLUMN artifact_paths TEXT");
            }
            if (!cols.contains("import_config")) {
                st.execute("ALTER TABLE import_runs ADD COLUMN import_config TEXT");
            }
            if (!cols.contains("as_of_datetime_ms")) {
                st.execute("ALTER TABLE import_runs ADD COLUMN as_of_datetime_ms INTEGER");
            }
        }
    }

    private void applyMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260301_001_import_runs_staleness",
                "Index terminal runs per target for staleness reporting",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_import_runs_target_status_finished ON import_runs(target, status, finished_at_ms)"
                )
        ));
        steps.add(new MigrationStep(
                "20260301_002_quarantine_envelope",
                "Index quarantined rows by envelope",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_price_list_quarantine_envelope ON price_list_quarantine(envelope_id)"
                )
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                """;
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
