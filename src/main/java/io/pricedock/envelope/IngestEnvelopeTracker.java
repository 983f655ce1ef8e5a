package io.pricedock.envelope;

import io.pricedock.ingest.FileFingerprint;
import io.pricedock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Records that a file was received. Adapts to whatever shape {@code ingest_envelope}
 * has on the target database and reports, instead of throwing, when it cannot insert.
 * Does not commit.
 */
public final class IngestEnvelopeTracker {
    static final String TABLE = "ingest_envelope";
    private static final Logger log = LoggerFactory.getLogger(IngestEnvelopeTracker.class);

    private final Clock clock;

    public IngestEnvelopeTracker() {
        this(Clock.systemUTC());
    }

    public IngestEnvelopeTracker(Clock clock) {
        this.clock = clock;
    }

    public EnvelopeCreateResult createBestEffort(Connection connection, String target, FileFingerprint file,
                                                 LocalDate asOfDate, Instant asOfDateTime,
                                                 Map<String, ?> metadata) {
        try {
            if (!tableExists(connection)) {
                return EnvelopeCreateResult.notCreated(TABLE + " table not found");
            }
            List<ColumnInfo> columns = columns(connection);
            String envelopeId = UUID.randomUUID().toString();
            long now = clock.millis();

            Map<String, Object> candidates = new LinkedHashMap<>();
            putIfPresent(candidates, columns, "envelope_id", envelopeId);
            putIfPresent(candidates, columns, "target", target);
            putIfPresent(candidates, columns, "source_filename", file.fileName());
            putIfPresent(candidates, columns, "file_sha256", file.sha256());
            putIfPresent(candidates, columns, "file_size_bytes", file.sizeBytes());
            putIfPresent(candidates, columns, "as_of_date", asOfDate == null ? null : asOfDate.toString());
            putIfPresent(candidates, columns, "as_of_datetime_ms", asOfDateTime == null ? null : asOfDateTime.toEpochMilli());
            putIfPresent(candidates, columns, "metadata", metadata == null ? null : Jsons.toCompactJson(metadata));
            putIfPresent(candidates, columns, "created_at_ms", now);
            putIfPresent(candidates, columns, "updated_at_ms", now);

            if (!candidates.containsKey("envelope_id")) {
                return EnvelopeCreateResult.notCreated(TABLE + " has no envelope_id column");
            }
            List<String> requiredMissing = new ArrayList<>();
            for (ColumnInfo col : columns) {
                if (col.notNull() && col.defaultValue() == null && !candidates.containsKey(col.name())) {
                    requiredMissing.add(col.name());
                }
            }
            if (!requiredMissing.isEmpty()) {
                return EnvelopeCreateResult.notCreated(
                        TABLE + " schema requires NOT NULL columns without defaults: " + requiredMissing
                );
            }

            String sql = "INSERT INTO " + TABLE + "(" + String.join(",", candidates.keySet()) + ") VALUES("
                    + String.join(",", Collections.nCopies(candidates.size(), "?")) + ")";
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                int i = 1;
                for (Object value : candidates.values()) {
                    ps.setObject(i++, value);
                }
                ps.executeUpdate();
            }
            log.info("ingest envelope created envelope_id={} file={}", envelopeId, file.fileName());
            return EnvelopeCreateResult.created(envelopeId);
        } catch (SQLException e) {
            return EnvelopeCreateResult.notCreated("envelope insert failed: " + e.getMessage());
        }
    }

    private boolean tableExists(Connection connection) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type='table' AND name=?")) {
            ps.setString(1, TABLE);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private List<ColumnInfo> columns(Connection connection) throws SQLException {
        List<ColumnInfo> out = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + TABLE + ")")) {
            while (rs.next()) {
                boolean integerPk = rs.getInt("pk") > 0 && "INTEGER".equalsIgnoreCase(rs.getString("type"));
                out.add(new ColumnInfo(
                        rs.getString("name"),
                        rs.getInt("notnull") == 1 && !integerPk,
                        rs.getString("dflt_value")
                ));
            }
        }
        return out;
    }

    private static void putIfPresent(Map<String, Object> candidates, List<ColumnInfo> columns, String name,
                                     Object value) {
        for (ColumnInfo col : columns) {
            if (col.name().equalsIgnoreCase(name)) {
                if (value != null) {
                    candidates.put(col.name(), value);
                }
                return;
            }
        }
    }

    private record ColumnInfo(String name, boolean notNull, String defaultValue) {
    }
}
