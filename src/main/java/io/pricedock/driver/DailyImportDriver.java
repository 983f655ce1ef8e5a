package io.pricedock.driver;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.catalog.CatalogPriceImporter;
import io.pricedock.config.IngestSettings;
import io.pricedock.config.PriceDockConfig;
import io.pricedock.envelope.IngestEnvelopeTracker;
import io.pricedock.ingest.FileFingerprint;
import io.pricedock.lock.FileNamedLock;
import io.pricedock.lock.LockNotAcquiredException;
import io.pricedock.lock.NamedLock;
import io.pricedock.model.AttemptAction;
import io.pricedock.model.ImportMode;
import io.pricedock.model.SupervisedStatus;
import io.pricedock.orchestrator.ImportFunction;
import io.pricedock.orchestrator.ImportOrchestrator;
import io.pricedock.orchestrator.ImportRequest;
import io.pricedock.orchestrator.OrchestratorResult;
import io.pricedock.quality.QualityGateRejectedException;
import io.pricedock.quality.QuarantineStore;
import io.pricedock.registry.RunMetrics;
import io.pricedock.storage.Database;
import io.pricedock.supervisor.StatusDocuments;
import io.pricedock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The worker side of a supervised run: selects inbox files, imports each one through the
 * {@link ImportOrchestrator} under the named daily-import lock, moves the file to archive or
 * quarantine, and returns the run document. {@link #run} never throws.
 */
public final class DailyImportDriver {
    private static final Logger log = LoggerFactory.getLogger(DailyImportDriver.class);
    private static final DateTimeFormatter MONTH_DIR = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);
    private static final int MAX_NAME_SUFFIX = 10_000;
    private static final DateTimeFormatter FILE_STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final PriceDockConfig config;
    private final IngestSettings settings;
    private final Database database;
    private final ImportOrchestrator orchestrator;
    private final ImportFunction importFunction;
    private final QuarantineStore quarantineStore;
    private final Clock clock;

    public DailyImportDriver(PriceDockConfig config, IngestSettings settings, Database database) {
        this(config, settings, database, new CatalogPriceImporter(database), Clock.systemUTC());
    }

    public DailyImportDriver(PriceDockConfig config, IngestSettings settings, Database database,
                             ImportFunction importFunction, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.database = database;
        this.orchestrator = new ImportOrchestrator(database, new IngestEnvelopeTracker(clock), clock);
        this.importFunction = importFunction;
        this.quarantineStore = new QuarantineStore(clock);
        this.clock = clock;
    }

    public ObjectNode run(String runId, ImportMode mode, List<String> files, String target) {
        String id = runId == null || runId.isBlank() ? UUID.randomUUID().toString() : runId.trim();
        ImportMode requested = mode == null ? ImportMode.AUTO : mode;
        String effectiveTarget = target == null || target.isBlank() ? settings.defaultTarget() : target.trim();
        Instant startedAt = clock.instant();
        SelectedMode selected = SelectedMode.of(requested);
        InboxFiles inbox = new InboxFiles(config.inboxDir(), settings.allowedExtensions());

        List<String> names = inbox.coalesceArguments(files);
        if (requested == ImportMode.FILES && names.isEmpty()) {
            return failure(id, requested, startedAt, "mode=files requires --files ...");
        }
        if (requested == ImportMode.FILES && names.size() > settings.maxFiles()) {
            return failure(id, requested, startedAt,
                    "Too many files: " + names.size() + " (max " + settings.maxFiles() + ")");
        }

        try (NamedLock lock = new FileNamedLock(config.locksDir(), settings.lockName())) {
            if (!lock.tryAcquire()) {
                throw new LockNotAcquiredException(lock.name());
            }
            List<FileResult> results = requested == ImportMode.AUTO
                    ? runAuto(inbox, effectiveTarget, id, startedAt)
                    : runFiles(inbox, names, effectiveTarget, id);
            return document(id, requested, selected, startedAt, results, results.isEmpty() ? null : noteFor(results));
        } catch (LockNotAcquiredException e) {
            log.warn("daily import not started run_id={}: {}", id, e.getMessage());
            return failure(id, requested, startedAt, e.getMessage());
        } catch (RuntimeException | IOException e) {
            log.error("daily import failed run_id={}", id, e);
            return failure(id, requested, startedAt, "Unexpected: " + e.getMessage());
        }
    }

    private List<FileResult> runAuto(InboxFiles inbox, String target, String runId, Instant startedAt)
            throws IOException {
        Optional<Path> newest = inbox.newest();
        if (newest.isEmpty()) {
            log.info("no files in inbox dir={}", inbox.inboxDir());
            return List.of(FileResult.rejected(null, SelectedMode.AUTO_INBOX_NEWEST, FileOutcome.SKIPPED,
                    SkipReason.NO_FILES_IN_INBOX, null, startedAt));
        }
        return List.of(processFile(newest.get(), SelectedMode.AUTO_INBOX_NEWEST, target, runId));
    }

    private List<FileResult> runFiles(InboxFiles inbox, List<String> names, String target, String runId) {
        List<FileResult> results = new ArrayList<>();
        for (String name : names) {
            Path path;
            try {
                path = inbox.resolve(name);
            } catch (InboxFiles.InvalidInboxFileException e) {
                FileOutcome outcome = e.reason() == SkipReason.INVALID_EXTENSION ? FileOutcome.SKIPPED : FileOutcome.ERROR;
                SkipReason reason = outcome == FileOutcome.SKIPPED ? e.reason() : null;
                log.warn("rejected --files entry '{}': {}", name, e.getMessage());
                results.add(FileResult.rejected(name, SelectedMode.MANUAL_LIST, outcome, reason, e.getMessage(),
                        clock.instant()));
                continue;
            }
            results.add(processFile(path, SelectedMode.MANUAL_LIST, target, runId));
        }
        return results;
    }

    FileResult processFile(Path file, SelectedMode mode, String target, String runId) {
        Instant startedAt = clock.instant();
        String name = file.getFileName().toString();
        LocalDate effectiveDate = EffectiveDates.fromFileNameOr(name, LocalDate.now(clock.withZone(ZoneOffset.UTC)));
        String sha256 = null;
        try {
            sha256 = FileFingerprint.sha256(file);
        } catch (IOException e) {
            return new FileResult(name, file.toString(), mode, FileOutcome.ERROR, null, effectiveDate, null, null,
                    0L, 0L, null, startedAt, clock.instant(), null, null, "Failed to read file: " + e.getMessage());
        }

        ImportRequest request = new ImportRequest(
                target,
                file,
                effectiveDate,
                null,
                "daily-import:" + runId,
                null,
                true,
                Map.of("source", "daily-import", "driver_run_id", runId),
                Map.of("selected_mode", mode.name())
        );
        OrchestratorResult result = orchestrator.run(request, importFunction);

        FileOutcome outcome;
        SkipReason skipReason = null;
        long rowsGood = 0L;
        long rowsQuarantine = 0L;
        String archivePath = null;
        String quarantinePath = null;
        String error = null;
        try {
            switch (result.status()) {
                case SUCCESS -> {
                    outcome = FileOutcome.IMPORTED;
                    rowsQuarantine = result.metric(RunMetrics.QUARANTINE_COUNT);
                    rowsGood = Math.max(0L, result.metric(RunMetrics.TOTAL_ROWS_PROCESSED) - rowsQuarantine);
                    archivePath = moveTo(config.archiveDir(), file);
                }
                case SKIPPED -> {
                    outcome = FileOutcome.SKIPPED;
                    skipReason = result.reason() != null
                            && result.reason().contains(AttemptAction.SKIP_ALREADY_SUCCESS.name())
                            ? SkipReason.ALREADY_IMPORTED_SAME_HASH
                            : SkipReason.OTHER;
                    error = skipReason == SkipReason.OTHER ? result.reason() : null;
                    archivePath = moveTo(config.archiveDir(), file);
                }
                default -> {
                    error = result.reason();
                    if (QualityGateRejectedException.class.getSimpleName().equals(result.errorType())) {
                        outcome = FileOutcome.QUARANTINED;
                        rowsQuarantine = quarantinedRows(result.runId());
                        quarantinePath = moveTo(config.quarantineDir(), file);
                    } else {
                        outcome = FileOutcome.ERROR;
                    }
                }
            }
        } catch (IOException e) {
            log.error("failed to move file={} after import run_id={}", name, result.runId(), e);
            outcome = FileOutcome.ERROR;
            error = "Failed to move file: " + e.getMessage();
        }
        log.info("file processed name={} outcome={} import_run_id={}", name, outcome, result.runId());
        return new FileResult(name, file.toString(), mode, outcome, skipReason, effectiveDate, result.runId(),
                result.envelopeId(), rowsGood, rowsQuarantine, sha256, startedAt, clock.instant(),
                archivePath, quarantinePath, error);
    }

    private long quarantinedRows(String importRunId) {
        if (importRunId == null) {
            return 0L;
        }
        try (Connection c = database.openConnection()) {
            return quarantineStore.listByRun(c, importRunId).size();
        } catch (Exception e) {
            log.warn("could not count quarantined rows run_id={}", importRunId, e);
            return 0L;
        }
    }

    private String moveTo(Path baseDir, Path file) throws IOException {
        Instant now = clock.instant();
        Path monthDir = baseDir.resolve(MONTH_DIR.format(now));
        Files.createDirectories(monthDir);
        Path dest = uniqueDestination(monthDir.resolve(FILE_STAMP.format(now) + "_" + file.getFileName()));
        Files.move(file, dest);
        Path root = config.rootDir();
        return dest.startsWith(root) ? root.relativize(dest).toString().replace('\\', '/') : dest.toString();
    }

    /**
     * {@code dest} itself when free, otherwise the first free {@code <stem>__N<ext>} next to it.
     */
    static Path uniqueDestination(Path dest) throws IOException {
        if (!Files.exists(dest)) {
            return dest;
        }
        String fileName = dest.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String ext = dot > 0 ? fileName.substring(dot) : "";
        for (int i = 1; i < MAX_NAME_SUFFIX; i++) {
            Path candidate = dest.resolveSibling(stem + "__" + i + ext);
            if (!Files.exists(candidate)) {
                return candidate;
            }
        }
        throw new IOException("No free destination name for: " + dest);
    }

    private static String noteFor(List<FileResult> results) {
        if (results.size() == 1 && results.get(0).skipReason() == SkipReason.NO_FILES_IN_INBOX) {
            return "No files in inbox";
        }
        return null;
    }

    private ObjectNode document(String runId, ImportMode requested, SelectedMode selected, Instant startedAt,
                                List<FileResult> results, String notes) {
        int imported = 0;
        int skipped = 0;
        int quarantined = 0;
        int failed = 0;
        long rowsGood = 0L;
        long rowsQuarantine = 0L;
        ArrayNode files = Jsons.mapper().createArrayNode();
        for (FileResult r : results) {
            switch (r.status()) {
                case IMPORTED -> imported++;
                case SKIPPED -> skipped++;
                case QUARANTINED -> quarantined++;
                case ERROR -> failed++;
            }
            rowsGood += r.rowsGood();
            rowsQuarantine += r.rowsQuarantine();
            files.add(r.toJson());
        }
        SupervisedStatus status;
        if (failed > 0) {
            status = SupervisedStatus.FAILED;
        } else if (skipped > 0 || quarantined > 0) {
            status = SupervisedStatus.OK_WITH_SKIPS;
        } else {
            status = SupervisedStatus.OK;
        }
        Instant finishedAt = clock.instant();
        ObjectNode doc = Jsons.mapper().createObjectNode();
        doc.put(StatusDocuments.RUN_ID, runId);
        doc.put(StatusDocuments.STATUS, status.name());
        doc.put(StatusDocuments.REQUESTED_MODE, requested.cliValue());
        doc.put(StatusDocuments.SELECTED_MODE, selected.name());
        doc.put(StatusDocuments.STARTED_AT, startedAt.toString());
        doc.put(StatusDocuments.FINISHED_AT, finishedAt.toString());
        doc.put(StatusDocuments.DURATION_MS, Duration.between(startedAt, finishedAt).toMillis());
        doc.set(StatusDocuments.FILES, files);
        ObjectNode summary = doc.putObject(StatusDocuments.SUMMARY);
        summary.put("files_total", results.size());
        summary.put("files_imported", imported);
        summary.put("files_skipped", skipped);
        summary.put("files_quarantined", quarantined);
        summary.put("files_failed", failed);
        summary.put("rows_good_total", rowsGood);
        summary.put("rows_quarantine_total", rowsQuarantine);
        summary.put("notes", notes);
        doc.put(StatusDocuments.MESSAGE, "Import finished: " + status.name());
        log.info("daily import finished run_id={} status={} files={}", runId, status, results.size());
        return doc;
    }

    private ObjectNode failure(String runId, ImportMode requested, Instant startedAt, String message) {
        ObjectNode doc = StatusDocuments.terminal(runId, requested, List.of(), SupervisedStatus.FAILED, startedAt,
                clock.instant(), message);
        ((ObjectNode) doc.get(StatusDocuments.SUMMARY)).put("notes", message);
        return doc;
    }
}
