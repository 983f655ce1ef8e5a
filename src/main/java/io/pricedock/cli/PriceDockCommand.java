package io.pricedock.cli;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.config.PriceDockConfig;
import io.pricedock.model.ImportMode;
import io.pricedock.model.ImportRun;
import io.pricedock.model.SupervisedStatus;
import io.pricedock.orchestrator.OrchestratorResult;
import io.pricedock.runtime.PriceDockRuntime;
import io.pricedock.supervisor.StatusDocuments;
import io.pricedock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "pricedock",
        mixinStandardHelpOptions = true,
        description = "Governed price list imports: run registry, quality gate and supervised daily imports",
        subcommands = {
                PriceDockCommand.InitCommand.class,
                PriceDockCommand.ImportCommand.class,
                PriceDockCommand.DailyImportCommand.class,
                PriceDockCommand.SuperviseCommand.class,
                PriceDockCommand.StatusCommand.class,
                PriceDockCommand.RunCommand.class,
                PriceDockCommand.RunsCommand.class,
                PriceDockCommand.HistoryCommand.class,
                PriceDockCommand.StalenessCommand.class,
                PriceDockCommand.ReapStaleCommand.class,
                PriceDockCommand.QuarantineCommand.class,
                PriceDockCommand.SchemaMigrationsCommand.class
        }
)
public final class PriceDockCommand implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(PriceDockCommand.class);

    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | import | daily-import | supervise | status | run | runs | history | staleness | reap-stale | quarantine | schema-migrations");
    }

    PriceDockRuntime runtime() {
        return new PriceDockRuntime(PriceDockConfig.fromRoot(root));
    }

    static int printError(String message) {
        System.out.println(Jsons.toJson(Map.of("error", message == null ? "unknown error" : message)));
        return 1;
    }

    @Command(name = "init", description = "Create directories and the SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println("Initialized PriceDock at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "import", description = "Import one price list file through the run registry")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Parameters(index = "0", description = "Price list file")
        String file;

        @Option(names = {"--target"}, description = "Import target (defaults to settings defaultTarget)")
        String target;

        @Option(names = {"--as-of"}, description = "Effective date YYYY-MM-DD (defaults to the date in the file name, then today UTC)")
        String asOf;

        @Option(names = {"--triggered-by"}, defaultValue = "manual", description = "Who started the import")
        String triggeredBy;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            LocalDate asOfDate = asOf == null || asOf.isBlank() ? null : LocalDate.parse(asOf.trim());
            OrchestratorResult result = runtime.importFile(Path.of(file), target, asOfDate, triggeredBy);
            System.out.println(Jsons.toJson(result));
            return result.status() == OrchestratorResult.Status.FAILED ? 1 : 0;
        }
    }

    @Command(name = "daily-import", description = "Import inbox files under the daily-import lock and print the run document")
    static final class DailyImportCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Option(names = {"--mode"}, required = true, description = "auto | files")
        String mode;

        @Option(names = {"--files"}, arity = "0..*", description = "Inbox file names (mode files)")
        List<String> files = new ArrayList<>();

        @Option(names = {"--run-id"}, description = "Run id to report (generated when absent)")
        String runId;

        @Option(names = {"--target"}, description = "Import target")
        String target;

        @Option(names = {"--no-status-file"}, defaultValue = "false",
                description = "Only print the document; the caller publishes it")
        boolean noStatusFile;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            ObjectNode doc;
            try {
                runtime.init();
                doc = runtime.dailyImport(runId, ImportMode.fromString(mode), files, target);
            } catch (RuntimeException e) {
                log.error("daily-import could not run", e);
                doc = StatusDocuments.terminal(
                        runId == null || runId.isBlank() ? "unknown" : runId,
                        ImportMode.AUTO,
                        List.of(),
                        SupervisedStatus.FAILED,
                        Instant.now(),
                        Instant.now(),
                        "Unexpected: " + e.getMessage()
                );
            }
            if (!noStatusFile) {
                try {
                    runtime.statusStore().write(doc.path(StatusDocuments.RUN_ID).asText(), doc);
                } catch (RuntimeException e) {
                    log.warn("could not write status document", e);
                }
            }
            System.out.println(Jsons.toJson(doc));
            return 0;
        }
    }

    @Command(name = "supervise", description = "Run daily-import in a child process with a timeout and publish its status document")
    static final class SuperviseCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Option(names = {"--mode"}, defaultValue = "auto", description = "auto | files")
        String mode;

        @Option(names = {"--files"}, arity = "0..*", description = "Inbox file names (mode files)")
        List<String> files = new ArrayList<>();

        @Option(names = {"--run-id"}, description = "Run id (generated when absent)")
        String runId;

        @Option(names = {"--target"}, description = "Import target")
        String target;

        @Option(names = {"--timeout-ms"}, description = "Child timeout in ms (defaults to settings supervisorTimeoutMs)")
        Long timeoutMs;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            ObjectNode doc;
            try {
                doc = runtime.supervise(runId, ImportMode.fromString(mode), files, target, timeoutMs);
            } catch (IllegalArgumentException e) {
                return printError(e.getMessage());
            }
            System.out.println(Jsons.toJson(doc));
            return 0;
        }
    }

    @Command(name = "status", description = "Show the status document of a supervised run")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Parameters(index = "0", description = "Supervised run id")
        String runId;

        @Override
        public Integer call() {
            Optional<ObjectNode> doc;
            try {
                doc = parent.runtime().status(runId);
            } catch (IllegalArgumentException e) {
                return printError(e.getMessage());
            }
            if (doc.isEmpty()) {
                return printError("status document not found");
            }
            System.out.println(Jsons.toJson(doc.get()));
            return 0;
        }
    }

    @Command(name = "run", description = "Show one import run from the registry")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Parameters(index = "0", description = "Import run id")
        String runId;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            Optional<ImportRun> run = runtime.run(runId);
            if (run.isEmpty()) {
                return printError("import run not found");
            }
            System.out.println(Jsons.toJson(run.get()));
            return 0;
        }
    }

    @Command(name = "runs", description = "List recent import runs")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Option(names = {"--target"}, description = "Filter by target")
        String target;

        @Option(names = {"--status"}, description = "Filter by run status")
        String status;

        @Option(names = {"--limit"}, defaultValue = "50", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.runs(limit, target, status)));
            return 0;
        }
    }

    @Command(name = "history", description = "List recent supervised runs")
    static final class HistoryCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max number of rows")
        int limit;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.history(limit)));
            return 0;
        }
    }

    @Command(name = "staleness", description = "Show time since the last successful import of a target")
    static final class StalenessCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Option(names = {"--target"}, description = "Import target")
        String target;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.staleness(target)));
            return 0;
        }
    }

    @Command(name = "reap-stale", description = "Roll back runs stuck in running or pending")
    static final class ReapStaleCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Option(names = {"--running-minutes"}, description = "Grace for running runs (defaults to settings)")
        Long runningMinutes;

        @Option(names = {"--pending-minutes"}, description = "Grace for pending runs (defaults to settings)")
        Long pendingMinutes;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.reapStale(runningMinutes, pendingMinutes)));
            return 0;
        }
    }

    @Command(name = "quarantine", description = "List quarantined rows of an import run")
    static final class QuarantineCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Parameters(index = "0", description = "Import run id")
        String runId;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.quarantine(runId)));
            return 0;
        }
    }

    @Command(name = "schema-migrations", description = "List applied schema migrations")
    static final class SchemaMigrationsCommand implements Callable<Integer> {
        @ParentCommand
        PriceDockCommand parent;

        @Override
        public Integer call() {
            PriceDockRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.schemaMigrations()));
            return 0;
        }
    }
}
