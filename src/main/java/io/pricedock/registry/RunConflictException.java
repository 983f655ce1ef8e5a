package io.pricedock.registry;

import java.time.LocalDate;

/**
 * Raised when a new attempt collides with a pending, running or successful run
 * holding the same blocking key. The caller's transaction is aborted and must be
 * rolled back before it is reused.
 */
public final class RunConflictException extends RuntimeException {
    private final String target;
    private final String fileSha256;
    private final LocalDate asOfDate;

    public RunConflictException(String target, String fileSha256, LocalDate asOfDate, Throwable cause) {
        super("Blocking import run already exists for target=" + target
                + " file_sha256=" + fileSha256 + " as_of_date=" + asOfDate, cause);
        this.target = target;
        this.fileSha256 = fileSha256;
        this.asOfDate = asOfDate;
    }

    public String target() {
        return target;
    }

    public String fileSha256() {
        return fileSha256;
    }

    public LocalDate asOfDate() {
        return asOfDate;
    }
}
