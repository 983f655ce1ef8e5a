package io.pricedock.lock;

public final class LockNotAcquiredException extends RuntimeException {
    private final String lockName;

    public LockNotAcquiredException(String lockName) {
        super("Lock is held by another process: " + lockName);
        this.lockName = lockName;
    }

    public String lockName() {
        return lockName;
    }
}
