package io.pricedock.model;

public enum SupervisedStatus {
    RUNNING,
    OK,
    OK_WITH_SKIPS,
    FAILED,
    TIMEOUT;

    public boolean terminal() {
        return this != RUNNING;
    }

    public static SupervisedStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FAILED;
        }
        for (SupervisedStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        return FAILED;
    }
}
