package io.pricedock.lock;

/**
 * A named mutual-exclusion resource held for the lifetime of one job invocation.
 * Released on {@link #close()} or when the holding process dies.
 */
public interface NamedLock extends AutoCloseable {
    String name();

    /**
     * Non-blocking. Returns {@code false} when another holder owns the lock.
     */
    boolean tryAcquire();

    boolean isHeld();

    @Override
    void close();
}
