package io.pricedock.model;

public enum ImportMode {
    AUTO("auto"),
    FILES("files");

    private final String cliValue;

    ImportMode(String cliValue) {
        this.cliValue = cliValue;
    }

    public String cliValue() {
        return cliValue;
    }

    public static ImportMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AUTO;
        }
        for (ImportMode value : values()) {
            if (value.cliValue.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown import mode: " + raw + " (expected auto or files)");
    }
}
