package io.pricedock.supervisor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.model.ImportMode;
import io.pricedock.model.SupervisedStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

final class StatusDocumentStoreTest {

    @Test
    void writeReplacesDocumentAndLeavesNoTempFile() throws Exception {
        Path dir = Files.createTempDirectory("pricedock-test-status-");
        try {
            StatusDocumentStore store = new StatusDocumentStore(dir.resolve("status"));
            Instant started = Instant.parse("2026-03-01T06:00:00Z");
            store.write("run-1", StatusDocuments.running("run-1", ImportMode.FILES, List.of("a.csv"), started));
            Assertions.assertEquals(SupervisedStatus.RUNNING, StatusDocuments.status(store.read("run-1").orElseThrow()));

            store.write("run-1", StatusDocuments.terminal("run-1", ImportMode.FILES, List.of("a.csv"), SupervisedStatus.OK, started,
                    started.plusSeconds(2), null));
            ObjectNode doc = store.read("run-1").orElseThrow();
            Assertions.assertEquals(SupervisedStatus.OK, StatusDocuments.status(doc));
            Assertions.assertEquals(2000L, doc.get(StatusDocuments.DURATION_MS).asLong());
            Assertions.assertFalse(Files.exists(dir.resolve("status").resolve("run-1.json.tmp")));
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void runningDocumentListsPendingFiles() {
        ObjectNode doc = StatusDocuments.running("run-2", ImportMode.FILES, List.of("a.csv", "b.csv"), Instant.EPOCH);
        Assertions.assertEquals(2, doc.get(StatusDocuments.FILES).size());
        Assertions.assertEquals("PENDING", doc.get(StatusDocuments.FILES).get(0).get("status").asText());
        Assertions.assertEquals(2, doc.get(StatusDocuments.SUMMARY).get("files_total").asInt());
        Assertions.assertEquals("files", doc.get(StatusDocuments.REQUESTED_MODE).asText());
    }

    @Test
    void partialDocumentReadsAsRunning() throws Exception {
        Path dir = Files.createTempDirectory("pricedock-test-status-");
        try {
            StatusDocumentStore store = new StatusDocumentStore(dir);
            Files.writeString(dir.resolve("run-3.json"), "{\"run_id\": \"run-3\", \"status\": \"O", StandardCharsets.UTF_8);
            ObjectNode doc = store.read("run-3").orElseThrow();
            Assertions.assertEquals(SupervisedStatus.RUNNING, StatusDocuments.status(doc));
            Assertions.assertEquals(StatusDocumentStore.IN_PROGRESS_MESSAGE, doc.get(StatusDocuments.MESSAGE).asText());
            Assertions.assertTrue(doc.hasNonNull(StatusDocuments.STARTED_AT));
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void missingDocumentIsEmpty() throws Exception {
        Path dir = Files.createTempDirectory("pricedock-test-status-");
        try {
            Optional<ObjectNode> doc = new StatusDocumentStore(dir).read("nothing-here");
            Assertions.assertTrue(doc.isEmpty());
        } finally {
            deleteRecursively(dir);
        }
    }

    @Test
    void runIdsThatCouldEscapeTheDirectoryAreRejected() {
        StatusDocumentStore store = new StatusDocumentStore(Path.of("status"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.documentPath("../etc/passwd"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.documentPath(""));
        Assertions.assertEquals("ok-run_1.json", store.documentPath("ok-run_1").getFileName().toString());
    }

    @Test
    void tailKeepsLastCharactersWithoutNul() {
        Assertions.assertEquals("cde", StatusDocuments.tail("ab\u0000cde", 3));
        Assertions.assertEquals("abc", StatusDocuments.tail("abc", 10));
        Assertions.assertNull(StatusDocuments.tail("", 10));
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
