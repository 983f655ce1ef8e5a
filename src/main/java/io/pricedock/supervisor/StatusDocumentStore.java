package io.pricedock.supervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.model.SupervisedStatus;
import io.pricedock.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One JSON document per supervised run under the status directory. Writes go to
 * {@code <run_id>.json.tmp} and are then moved over {@code <run_id>.json}, so readers see
 * either the previous or the new document.
 */
public final class StatusDocumentStore {
    static final String IN_PROGRESS_MESSAGE = "Import in progress (log updating)...";
    private static final Pattern RUN_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0,127}$");

    private final Path statusDir;

    public StatusDocumentStore(Path statusDir) {
        this.statusDir = statusDir;
    }

    public Path statusDir() {
        return statusDir;
    }

    public Path documentPath(String runId) {
        return statusDir.resolve(validRunId(runId) + ".json");
    }

    public void write(String runId, ObjectNode document) {
        Path target = documentPath(runId);
        Path tmp = statusDir.resolve(validRunId(runId) + ".json.tmp");
        try {
            Files.createDirectories(statusDir);
            Files.writeString(tmp, Jsons.toJson(document), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new RuntimeException("Failed to write status document for run: " + runId, e);
        }
    }

    /**
     * The current document, or empty when none was written. A document that does not parse
     * is being replaced right now and reads as {@code RUNNING}.
     */
    public Optional<ObjectNode> read(String runId) {
        Path path = documentPath(runId);
        String raw;
        Instant modifiedAt;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
            modifiedAt = Files.getLastModifiedTime(path).toInstant();
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read status document for run: " + runId, e);
        }
        try {
            JsonNode parsed = Jsons.readTree(raw);
            if (parsed instanceof ObjectNode doc) {
                return Optional.of(doc);
            }
        } catch (IOException ignored) {
            // partial write, fall through
        }
        return Optional.of(inProgress(runId, modifiedAt));
    }

    private ObjectNode inProgress(String runId, Instant modifiedAt) {
        ObjectNode doc = Jsons.mapper().createObjectNode();
        doc.put(StatusDocuments.RUN_ID, runId);
        doc.put(StatusDocuments.STATUS, SupervisedStatus.RUNNING.name());
        doc.put(StatusDocuments.STARTED_AT, modifiedAt.toString());
        doc.putNull(StatusDocuments.FINISHED_AT);
        doc.put(StatusDocuments.MESSAGE, IN_PROGRESS_MESSAGE);
        return doc;
    }

    static String validRunId(String runId) {
        if (runId == null || !RUN_ID.matcher(runId).matches()) {
            throw new IllegalArgumentException("Invalid run id: " + runId);
        }
        return runId;
    }
}
