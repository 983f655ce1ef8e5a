package io.pricedock.lock;

import io.pricedock.ingest.FileFingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link NamedLock} backed by an OS file lock on {@code <locksDir>/<key>.lock}, where the key
 * is derived from the SHA-256 of the lock name. The OS drops the lock when the process exits.
 *
 * <p>OS file locks belong to the whole process and closing any channel on the file releases
 * them, so holders inside this JVM are tracked in a shared map and a contended acquire never
 * touches the file.
 */
public final class FileNamedLock implements NamedLock {
    private static final Logger log = LoggerFactory.getLogger(FileNamedLock.class);
    private static final ConcurrentMap<Path, FileNamedLock> HELD_IN_JVM = new ConcurrentHashMap<>();

    private final String name;
    private final Path lockFile;
    private FileChannel channel;
    private FileLock lock;

    public FileNamedLock(Path locksDir, String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("lock name must not be blank");
        }
        this.name = name;
        this.lockFile = locksDir.resolve(lockKey(name) + ".lock").toAbsolutePath().normalize();
    }

    static String lockKey(String name) {
        return FileFingerprint.sha256Hex(name).substring(0, 16);
    }

    @Override
    public String name() {
        return name;
    }

    public Path lockFile() {
        return lockFile;
    }

    @Override
    public synchronized boolean tryAcquire() {
        if (lock != null) {
            return true;
        }
        if (HELD_IN_JVM.putIfAbsent(lockFile, this) != null) {
            return false;
        }
        boolean acquiredHere = false;
        try {
            Files.createDirectories(lockFile.getParent());
            FileChannel ch = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock acquired;
            try {
                acquired = ch.tryLock();
            } catch (IOException | OverlappingFileLockException e) {
                ch.close();
                throw e;
            }
            if (acquired == null) {
                ch.close();
                return false;
            }
            channel = ch;
            lock = acquired;
            acquiredHere = true;
            log.info("lock acquired name={} file={}", name, lockFile);
            return true;
        } catch (IOException e) {
            throw new RuntimeException("Failed to acquire lock: " + name, e);
        } finally {
            if (!acquiredHere) {
                HELD_IN_JVM.remove(lockFile, this);
            }
        }
    }

    @Override
    public synchronized boolean isHeld() {
        return lock != null && lock.isValid();
    }

    @Override
    public synchronized void close() {
        try {
            if (lock != null) {
                lock.release();
            }
            if (channel != null) {
                channel.close();
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to release lock: " + name, e);
        } finally {
            if (lock != null || channel != null) {
                HELD_IN_JVM.remove(lockFile, this);
            }
            lock = null;
            channel = null;
        }
    }
}
