package io.pricedock.model;

public enum ProcessingMode {
    ATOMIC("atomic"),
    CHUNKED("chunked");

    private final String dbValue;

    ProcessingMode(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static ProcessingMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ATOMIC;
        }
        for (ProcessingMode value : values()) {
            if (value.dbValue.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown processing mode: " + raw);
    }
}
