package io.pricedock.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class PriceDockConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DEFAULT_TARGET = "primary";
    public static final String DEFAULT_LOCK_NAME = "daily-import";
    public static final long DEFAULT_SUPERVISOR_TIMEOUT_MS = 15L * 60L * 1000L;
    public static final long DEFAULT_KILL_GRACE_MS = 10_000L;
    public static final int DEFAULT_STDIO_TAIL_CHARS = 2_000;
    public static final long DEFAULT_STALE_RUNNING_MINUTES = 120L;
    public static final long DEFAULT_STALE_PENDING_MINUTES = 15L;
    public static final int DEFAULT_MAX_FILES = 50;
    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5_000;

    private final Path rootDir;

    public PriceDockConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static PriceDockConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new PriceDockConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("pricedock.db");
    }

    public Path settingsFile() {
        return rootDir.resolve("pricedock-settings.json");
    }

    public Path inboxDir() {
        return rootDir.resolve("inbox");
    }

    public Path archiveDir() {
        return rootDir.resolve("archive");
    }

    public Path quarantineDir() {
        return rootDir.resolve("quarantine");
    }

    public Path statusDir() {
        return rootDir.resolve("status");
    }

    public Path locksDir() {
        return rootDir.resolve("locks");
    }
}
