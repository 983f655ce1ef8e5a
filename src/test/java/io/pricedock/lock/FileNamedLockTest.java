package io.pricedock.lock;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class FileNamedLockTest {

    @Test
    void secondHolderIsRefusedUntilRelease() throws Exception {
        Path dir = Files.createTempDirectory("pricedock-test-lock-");
        try {
            try (FileNamedLock first = new FileNamedLock(dir, "daily-import")) {
                Assertions.assertTrue(first.tryAcquire());
                Assertions.assertTrue(first.isHeld());
                Assertions.assertTrue(first.tryAcquire());
                try (FileNamedLock second = new FileNamedLock(dir, "daily-import")) {
                    Assertions.assertFalse(second.tryAcquire());
                    Assertions.assertFalse(second.isHeld());
                }
            }
            try (FileNamedLock third = new FileNamedLock(dir, "daily-import")) {
                Assertions.assertTrue(third.tryAcquire());
            }
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void refusedAcquireKeepsOsLockForOtherProcesses() throws Exception {
        Path dir = Files.createTempDirectory("pricedock-test-lock-");
        try {
            try (FileNamedLock first = new FileNamedLock(dir, "daily-import")) {
                Assertions.assertTrue(first.tryAcquire());
                Assertions.assertEquals("BLOCKED", contend(first.lockFile()));

                try (FileNamedLock second = new FileNamedLock(dir, "daily-import")) {
                    Assertions.assertFalse(second.tryAcquire());
                }
                Assertions.assertTrue(first.isHeld());
                Assertions.assertEquals("BLOCKED", contend(first.lockFile()));
            }
            Assertions.assertEquals("ACQUIRED", contend(dir.resolve(FileNamedLock.lockKey("daily-import") + ".lock")));
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void differentNamesDoNotContend() throws Exception {
        Path dir = Files.createTempDirectory("pricedock-test-lock-");
        try (FileNamedLock a = new FileNamedLock(dir, "daily-import");
             FileNamedLock b = new FileNamedLock(dir, "reindex")) {
            Assertions.assertTrue(a.tryAcquire());
            Assertions.assertTrue(b.tryAcquire());
            Assertions.assertNotEquals(a.lockFile(), b.lockFile());
            Assertions.assertEquals(16, FileNamedLock.lockKey("daily-import").length());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void blankNameIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new FileNamedLock(Path.of("locks"), " "));
    }

    private static String contend(Path lockFile) throws Exception {
        List<String> cmd = List.of(
                Paths.get(System.getProperty("java.home"), "bin", "java").toString(),
                "-cp", System.getProperty("java.class.path"),
                LockContenderMain.class.getName(),
                lockFile.toString());
        Process process = new ProcessBuilder(cmd).redirectError(ProcessBuilder.Redirect.DISCARD).start();
        String out = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8).strip();
        Assertions.assertTrue(process.waitFor(30, TimeUnit.SECONDS), "contender did not finish");
        Assertions.assertEquals(0, process.exitValue(), out);
        String[] lines = out.split("\\R");
        return lines[lines.length - 1].strip();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            walk.sorted(Comparator.comparingInt(Path::getNameCount).reversed())
                    .forEach(p -> {
                        try {
                            Files.deleteIfExists(p);
                        } catch (IOException ignored) {
                        }
                    });
        }
    }
}
