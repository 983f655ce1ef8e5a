package io.pricedock.model;

import java.util.Set;

public enum ImportRunStatus {
    PENDING("pending"),
    RUNNING("running"),
    SUCCESS("success"),
    FAILED("failed"),
    SKIPPED("skipped"),
    ROLLED_BACK("rolled_back");

    /**
     * Statuses covered by the blocking-key unique index.
     */
    public static final Set<ImportRunStatus> BLOCKING = Set.of(PENDING, RUNNING, SUCCESS);

    private final String dbValue;

    ImportRunStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean blocking() {
        return BLOCKING.contains(this);
    }

    public static ImportRunStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Import run status must not be blank");
        }
        for (ImportRunStatus value : values()) {
            if (value.dbValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown import run status: " + raw);
    }
}
