package io.pricedock.orchestrator;

import io.pricedock.envelope.EnvelopeCreateResult;
import io.pricedock.envelope.IngestEnvelopeTracker;
import io.pricedock.ingest.FileFingerprint;
import io.pricedock.model.AttemptAction;
import io.pricedock.model.AttemptDecision;
import io.pricedock.registry.ImportRunRegistry;
import io.pricedock.registry.RunConflictException;
import io.pricedock.registry.RunMetrics;
import io.pricedock.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives one governed import attempt:
 * registry pending, registry running, business transaction, registry terminal.
 *
 * <p>Registry writes go through one connection and are committed step by step; the import
 * function gets a second connection with its own transaction, so a business rollback never
 * undoes ledger state and a ledger failure never undoes committed catalog data.
 * {@link #run} reports every outcome as an {@link OrchestratorResult} and does not throw.
 */
public final class ImportOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ImportOrchestrator.class);

    private final Database database;
    private final IngestEnvelopeTracker envelopeTracker;
    private final Clock clock;

    public ImportOrchestrator(Database database) {
        this(database, new IngestEnvelopeTracker(), Clock.systemUTC());
    }

    public ImportOrchestrator(Database database, IngestEnvelopeTracker envelopeTracker, Clock clock) {
        this.database = database;
        this.envelopeTracker = envelopeTracker;
        this.clock = clock;
    }

    public OrchestratorResult run(ImportRequest request, ImportFunction importFunction) {
        FileFingerprint file;
        try {
            file = FileFingerprint.of(request.filePath());
        } catch (RuntimeException e) {
            log.error("import rejected before registration file={}", request.filePath(), e);
            return OrchestratorResult.failed(null, null, e);
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                return runGoverned(c, request, file, importFunction);
            } finally {
                rollbackQuietly(c);
                c.setAutoCommit(true);
            }
        } catch (SQLException | RuntimeException e) {
            log.error("import orchestration failed target={} file={}", request.target(), file.fileName(), e);
            return OrchestratorResult.failed(null, null, e);
        }
    }

    private OrchestratorResult runGoverned(Connection c, ImportRequest request, FileFingerprint file,
                                           ImportFunction importFunction) throws SQLException {
        ImportRunRegistry registry = new ImportRunRegistry(c, request.processingMode(), clock);
        ImportRunRegistry.NewAttempt attempt = new ImportRunRegistry.NewAttempt(
                request.target(),
                file,
                request.asOfDate(),
                request.triggeredBy(),
                request.asOfDateTime(),
                null,
                new LinkedHashMap<>(request.options())
        );

        AttemptDecision decision = registry.checkAttemptOrGetBlocker(request.target(), file, request.asOfDate());
        // end the read snapshot so the insert below opens a fresh write transaction
        c.rollback();
        if (decision.action().skip()) {
            String reason = decision.describe();
            log.info("import skipped target={} file={} as_of_date={} reason={}",
                    request.target(), file.fileName(), request.asOfDate(), reason);
            if (request.recordSkippedAttempt()) {
                recordSkip(c, registry, attempt, reason);
            }
            return OrchestratorResult.skipped(reason);
        }
        if (decision.action() == AttemptAction.RETRY_AFTER_FAILED) {
            log.info("retrying after previous attempt {}", decision.blocker().describe());
        }

        String runId;
        try {
            runId = registry.createAttempt(attempt);
            c.commit();
        } catch (RunConflictException e) {
            rollbackQuietly(c);
            AttemptDecision raced = registry.checkAttemptOrGetBlocker(request.target(), file, request.asOfDate());
            c.rollback();
            String reason = "conflict -> " + raced.describe();
            log.info("import skipped after losing creation race: {}", reason);
            return OrchestratorResult.skipped(reason);
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(c);
            log.error("failed to register import attempt file={}", file.fileName(), e);
            return OrchestratorResult.failed(null, null, e);
        }

        try {
            registry.markRunning(runId);
            c.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(c);
            log.error("failed to mark run running run_id={}", runId, e);
            return OrchestratorResult.failed(runId, null, e);
        }

        String envelopeId = attachEnvelopeBestEffort(c, registry, runId, request, file);

        ImportContext context = new ImportContext(
                request.target(),
                request.filePath(),
                request.asOfDate(),
                runId,
                envelopeId,
                request.options()
        );
        long startedAt = clock.millis();
        log.info("import_run_started target={} run_id={} envelope_id={} as_of_date={}",
                request.target(), runId, envelopeId, request.asOfDate());
        ImportPayload payload;
        try {
            payload = runBusinessTransaction(importFunction, context);
        } catch (Exception e) {
            return markFailed(c, registry, runId, envelopeId, e);
        }

        Map<String, Long> metrics = RunMetrics.filter(payload.metrics());
        try {
            registry.markSuccess(runId, metrics, payload.artifacts(), envelopeId);
            c.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(c);
            log.error("import committed but run could not be marked success run_id={}", runId, e);
            return OrchestratorResult.failed(runId, envelopeId, e);
        }
        log.info("import_run_success target={} run_id={} duration_ms={} metrics={}",
                request.target(), runId, clock.millis() - startedAt, metrics);
        return OrchestratorResult.success(runId, envelopeId, metrics);
    }

    private ImportPayload runBusinessTransaction(ImportFunction importFunction, ImportContext context) throws Exception {
        try (Connection business = database.openConnection()) {
            business.setAutoCommit(false);
            try {
                ImportPayload payload = importFunction.importFile(business, context);
                business.commit();
                return payload == null ? ImportPayload.empty() : payload;
            } catch (Exception e) {
                business.rollback();
                throw e;
            } finally {
                business.setAutoCommit(true);
            }
        }
    }

    private void recordSkip(Connection c, ImportRunRegistry registry, ImportRunRegistry.NewAttempt attempt,
                            String reason) {
        try {
            registry.createSkippedAttempt(attempt, reason);
            c.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(c);
            log.warn("failed to record skipped attempt for file={}", attempt.file().fileName(), e);
        }
    }

    private String attachEnvelopeBestEffort(Connection c, ImportRunRegistry registry, String runId,
                                            ImportRequest request, FileFingerprint file) {
        try {
            EnvelopeCreateResult envelope = envelopeTracker.createBestEffort(
                    c,
                    request.target(),
                    file,
                    request.asOfDate(),
                    request.asOfDateTime(),
                    request.envelopeMetadata()
            );
            if (!envelope.isCreated()) {
                c.rollback();
                log.warn("ingest envelope not created run_id={} reason={}", runId, envelope.reason());
                return null;
            }
            c.commit();
            registry.attachEnvelope(runId, envelope.envelopeId());
            c.commit();
            return envelope.envelopeId();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(c);
            log.warn("envelope creation failed, continuing without envelope run_id={}", runId, e);
            return null;
        }
    }

    private OrchestratorResult markFailed(Connection c, ImportRunRegistry registry, String runId, String envelopeId,
                                          Exception error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", error.getClass().getSimpleName());
        details.put("message", errorSummary(error));
        try {
            registry.markFailed(runId, errorSummary(error), details);
            c.commit();
        } catch (SQLException | RuntimeException e) {
            rollbackQuietly(c);
            log.error("failed to record import failure run_id={}", runId, e);
        }
        log.error("import_run_failed run_id={} envelope_id={}", runId, envelopeId, error);
        return OrchestratorResult.failed(runId, envelopeId, error);
    }

    static String errorSummary(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }

    private static void rollbackQuietly(Connection c) {
        try {
            c.rollback();
        } catch (SQLException e) {
            log.warn("rollback failed", e);
        }
    }
}
