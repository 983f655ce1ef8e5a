package io.pricedock.quality;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.pricedock.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only store for rows the quality gate rejected. Inserts only; the table carries
 * triggers that abort updates and deletes. Does not commit.
 */
public final class QuarantineStore {
    private static final TypeReference<List<String>> RULES_TYPE = new TypeReference<>() {
    };

    private final Clock clock;

    public QuarantineStore() {
        this(Clock.systemUTC());
    }

    public QuarantineStore(Clock clock) {
        this.clock = clock;
    }

    public int persist(Connection connection, String runId, String envelopeId, List<RejectedRow> rejected) {
        if (rejected == null || rejected.isEmpty()) {
            return 0;
        }
        long now = clock.millis();
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT INTO price_list_quarantine(run_id,envelope_id,code,raw_row,dq_errors,created_at_ms) VALUES(?,?,?,?,?,?)")) {
            for (RejectedRow row : rejected) {
                ps.setString(1, runId);
                ps.setString(2, envelopeId);
                ps.setString(3, row.code());
                ps.setString(4, Jsons.toCompactJson(row.row().fields()));
                ps.setString(5, Jsons.toCompactJson(row.violatedRules()));
                ps.setLong(6, now);
                ps.addBatch();
            }
            ps.executeBatch();
            return rejected.size();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to persist quarantined rows for run: " + runId, e);
        }
    }

    public List<QuarantineRecord> listByRun(Connection connection, String runId) {
        List<QuarantineRecord> out = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT id,run_id,envelope_id,code,raw_row,dq_errors,created_at_ms FROM price_list_quarantine WHERE run_id=? ORDER BY id ASC")) {
            ps.setString(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new QuarantineRecord(
                            rs.getLong("id"),
                            rs.getString("run_id"),
                            rs.getString("envelope_id"),
                            rs.getString("code"),
                            Jsons.toMap(rs.getString("raw_row")),
                            Jsons.mapper().readValue(rs.getString("dq_errors"), RULES_TYPE),
                            Instant.ofEpochMilli(rs.getLong("created_at_ms"))
                    ));
                }
            }
            return out;
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Failed to list quarantined rows for run: " + runId, e);
        }
    }

    public record QuarantineRecord(
            long id,
            String runId,
            String envelopeId,
            String code,
            Map<String, Object> rawRow,
            List<String> violatedRules,
            Instant createdAt
    ) {
    }
}
