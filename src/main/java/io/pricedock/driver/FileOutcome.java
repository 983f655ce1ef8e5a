package io.pricedock.driver;

public enum FileOutcome {
    IMPORTED,
    SKIPPED,
    QUARANTINED,
    ERROR
}
