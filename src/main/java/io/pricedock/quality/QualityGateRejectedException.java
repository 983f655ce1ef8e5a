package io.pricedock.quality;

/**
 * Thrown by an import when the gate rejected every row, so nothing usable reached the catalog.
 */
public final class QualityGateRejectedException extends RuntimeException {
    private final int rejectedRows;

    public QualityGateRejectedException(int rejectedRows) {
        super("All " + rejectedRows + " rows rejected by quality gate");
        this.rejectedRows = rejectedRows;
    }

    public int rejectedRows() {
        return rejectedRows;
    }
}
