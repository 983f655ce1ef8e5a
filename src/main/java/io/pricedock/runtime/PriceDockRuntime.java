package io.pricedock.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.catalog.CatalogPriceImporter;
import io.pricedock.config.IngestSettings;
import io.pricedock.config.PriceDockConfig;
import io.pricedock.driver.DailyImportDriver;
import io.pricedock.driver.EffectiveDates;
import io.pricedock.model.ImportMode;
import io.pricedock.model.ImportRun;
import io.pricedock.model.ImportRunStatus;
import io.pricedock.orchestrator.ImportOrchestrator;
import io.pricedock.orchestrator.ImportRequest;
import io.pricedock.orchestrator.OrchestratorResult;
import io.pricedock.quality.QuarantineStore;
import io.pricedock.registry.ImportRunRegistry;
import io.pricedock.registry.StaleRunReaper;
import io.pricedock.storage.Database;
import io.pricedock.supervisor.ImportSupervisor;
import io.pricedock.supervisor.JavaWorkerCommandFactory;
import io.pricedock.supervisor.StatusDocumentStore;
import io.pricedock.supervisor.SupervisedRequest;
import io.pricedock.supervisor.SupervisedRunJournal;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Wires configuration, storage and the import components for one data root.
 */
public final class PriceDockRuntime {
    private final PriceDockConfig config;
    private final IngestSettings settings;
    private final Database database;
    private final Clock clock;

    public PriceDockRuntime(PriceDockConfig config) {
        this(config, IngestSettings.load(config), Clock.systemUTC());
    }

    public PriceDockRuntime(PriceDockConfig config, IngestSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config, settings.busyTimeoutMs());
        this.clock = clock;
    }

    public PriceDockConfig config() {
        return config;
    }

    public IngestSettings settings() {
        return settings;
    }

    public Database database() {
        return database;
    }

    public void init() {
        database.init();
    }

    public OrchestratorResult importFile(Path file, String target, LocalDate asOfDate, String triggeredBy) {
        LocalDate date = asOfDate != null
                ? asOfDate
                : EffectiveDates.fromFileNameOr(file.getFileName().toString(), LocalDate.now(clock.withZone(ZoneOffset.UTC)));
        ImportRequest request = ImportRequest.of(effectiveTarget(target), file, date, triggeredBy);
        return new ImportOrchestrator(database).run(request, new CatalogPriceImporter(database));
    }

    public ObjectNode dailyImport(String runId, ImportMode mode, List<String> files, String target) {
        return new DailyImportDriver(config, settings, database).run(runId, mode, files, effectiveTarget(target));
    }

    public ObjectNode supervise(String runId, ImportMode mode, List<String> files, String target, Long timeoutMs) {
        long effectiveTimeout = timeoutMs == null || timeoutMs <= 0 ? settings.supervisorTimeoutMs() : timeoutMs;
        SupervisedRequest request = new SupervisedRequest(runId, mode, files);
        try (ImportSupervisor supervisor = new ImportSupervisor(
                statusStore(),
                new SupervisedRunJournal(database, clock),
                new JavaWorkerCommandFactory(config.rootDir(), effectiveTarget(target)),
                Duration.ofMillis(effectiveTimeout),
                Duration.ofMillis(settings.killGraceMs()),
                settings.stdioTailChars(),
                clock
        )) {
            return supervisor.runSync(request);
        }
    }

    public Optional<ObjectNode> status(String runId) {
        return statusStore().read(runId);
    }

    public StatusDocumentStore statusStore() {
        return new StatusDocumentStore(config.statusDir());
    }

    public Optional<ImportRun> run(String runId) {
        try (Connection c = database.openConnection()) {
            return new ImportRunRegistry(c).findRun(runId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read import run: " + runId, e);
        }
    }

    public List<ImportRun> runs(int limit, String target, String status) {
        ImportRunStatus filter = status == null || status.isBlank() ? null : ImportRunStatus.fromString(status);
        try (Connection c = database.openConnection()) {
            return new ImportRunRegistry(c).listRecent(limit, target, filter);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list import runs", e);
        }
    }

    public ImportRunRegistry.StalenessReport staleness(String target) {
        try (Connection c = database.openConnection()) {
            return new ImportRunRegistry(c, null, clock).staleness(effectiveTarget(target));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to compute staleness", e);
        }
    }

    public List<SupervisedRunJournal.SupervisedRunRow> history(int limit) {
        return new SupervisedRunJournal(database, clock).listRecent(limit);
    }

    public StaleRunReaper.ReapSummary reapStale(Long runningMinutes, Long pendingMinutes) {
        long running = runningMinutes == null || runningMinutes <= 0 ? settings.staleRunningMinutes() : runningMinutes;
        long pending = pendingMinutes == null || pendingMinutes <= 0 ? settings.stalePendingMinutes() : pendingMinutes;
        return new StaleRunReaper(database, Duration.ofMinutes(running), Duration.ofMinutes(pending), clock).reap();
    }

    public List<QuarantineStore.QuarantineRecord> quarantine(String runId) {
        try (Connection c = database.openConnection()) {
            return new QuarantineStore(clock).listByRun(c, runId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read quarantine for run: " + runId, e);
        }
    }

    public List<Database.SchemaMigrationRow> schemaMigrations() {
        return database.listSchemaMigrations();
    }

    private String effectiveTarget(String target) {
        return target == null || target.isBlank() ? settings.defaultTarget() : target.trim();
    }
}
