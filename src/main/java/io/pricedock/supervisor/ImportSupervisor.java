package io.pricedock.supervisor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.pricedock.model.SupervisedStatus;
import io.pricedock.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the daily import as a child process under a hard deadline and publishes its progress
 * as a status document.
 *
 * <p>The {@code RUNNING} document exists before the child is spawned, so a poller never sees
 * "unknown run". On timeout the child and its descendants get a graceful signal, then a
 * forced kill after the grace period; the run ends as {@code TIMEOUT}, never {@code FAILED}.
 */
public final class ImportSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ImportSupervisor.class);
    private static final Duration FORCE_KILL_WAIT = Duration.ofSeconds(5);
    private static final AtomicInteger THREAD_SEQ = new AtomicInteger();

    private final StatusDocumentStore store;
    private final SupervisedRunJournal journal;
    private final WorkerCommandFactory commandFactory;
    private final Duration timeout;
    private final Duration killGrace;
    private final int tailChars;
    private final Clock clock;
    private final ExecutorService executor;

    public ImportSupervisor(StatusDocumentStore store, SupervisedRunJournal journal,
                            WorkerCommandFactory commandFactory, Duration timeout, Duration killGrace,
                            int tailChars, Clock clock) {
        this.store = store;
        this.journal = journal;
        this.commandFactory = commandFactory;
        this.timeout = timeout;
        this.killGrace = killGrace;
        this.tailChars = Math.max(1, tailChars);
        this.clock = clock;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pricedock-supervisor-" + THREAD_SEQ.incrementAndGet());
            t.setDaemon(false);
            return t;
        });
    }

    /**
     * Publishes the {@code RUNNING} document, then supervises the child in the background.
     */
    public Handle start(SupervisedRequest request) {
        Instant startedAt = clock.instant();
        ObjectNode running = StatusDocuments.running(request.runId(), request.mode(), request.files(), startedAt);
        store.write(request.runId(), running);
        if (journal != null) {
            journal.recordStart(request.runId(), request.mode(), running);
        }
        log.info("supervised import started run_id={} mode={}", request.runId(), request.mode().cliValue());
        Future<ObjectNode> done = executor.submit(() -> supervise(request, running, startedAt));
        return new Handle(request.runId(), done);
    }

    public ObjectNode runSync(SupervisedRequest request) {
        return start(request).await();
    }

    private ObjectNode supervise(SupervisedRequest request, ObjectNode running, Instant startedAt) {
        String runId = request.runId();
        Path stdoutFile = store.statusDir().resolve(runId + ".stdout.log");
        Path stderrFile = store.statusDir().resolve(runId + ".stderr.log");
        ObjectNode result;
        try {
            result = execute(request, running, startedAt, stdoutFile, stderrFile);
        } catch (RuntimeException e) {
            log.error("supervisor failure run_id={}", runId, e);
            result = StatusDocuments.terminal(runId, request.mode(), request.files(),
                    SupervisedStatus.FAILED, startedAt, clock.instant(), "Supervisor error: " + e.getMessage());
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
        store.write(runId, result);
        if (journal != null) {
            journal.recordFinish(runId, request.mode(), result);
        }
        log.info("supervised import finished run_id={} status={}", runId, StatusDocuments.status(result));
        return result;
    }

    private ObjectNode execute(SupervisedRequest request, ObjectNode running, Instant startedAt,
                               Path stdoutFile, Path stderrFile) {
        String runId = request.runId();
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(commandFactory.command(request)));
        pb.redirectOutput(stdoutFile.toFile());
        pb.redirectError(stderrFile.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return StatusDocuments.terminal(runId, request.mode(), request.files(),
                    SupervisedStatus.FAILED, startedAt, clock.instant(), "Worker spawn failed: " + e.getMessage());
        }
        ObjectNode withPid = running.deepCopy();
        withPid.put(StatusDocuments.PID, process.pid());
        store.write(runId, withPid);

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                boolean alive = terminate(process);
                ObjectNode doc = StatusDocuments.terminal(runId, request.mode(), request.files(),
                        SupervisedStatus.TIMEOUT, startedAt,
                        clock.instant(), "Import timeout (>" + timeout.toMillis() + " ms). Process terminated.");
                doc.put(StatusDocuments.PID, process.pid());
                doc.put(StatusDocuments.CHILD_ALIVE, alive);
                putTails(doc, stdoutFile, stderrFile);
                if (alive) {
                    log.error("worker still alive after forced kill run_id={} pid={}", runId, process.pid());
                } else {
                    log.warn("worker timed out and was terminated run_id={} pid={}", runId, process.pid());
                }
                return doc;
            }
            return interpret(request, startedAt, process.exitValue(), stdoutFile, stderrFile);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            boolean alive = terminate(process);
            ObjectNode doc = StatusDocuments.terminal(runId, request.mode(), request.files(),
                    SupervisedStatus.FAILED, startedAt, clock.instant(), "Supervisor interrupted. Process terminated.");
            doc.put(StatusDocuments.CHILD_ALIVE, alive);
            return doc;
        }
    }

    private ObjectNode interpret(SupervisedRequest request, Instant startedAt, int exitCode, Path stdoutFile,
                                 Path stderrFile) {
        String runId = request.runId();
        Instant finishedAt = clock.instant();
        String stdout = readQuietly(stdoutFile);
        JsonNode parsed = null;
        String parseError = null;
        try {
            parsed = stdout.isBlank() ? null : Jsons.readTree(stdout.strip());
        } catch (JsonProcessingException e) {
            parseError = e.getOriginalMessage();
        }

        if (!(parsed instanceof ObjectNode doc)) {
            String error = exitCode != 0
                    ? "Worker exited with code " + exitCode + " without a valid result"
                    : "Invalid JSON from worker: " + (parseError == null ? "expected a JSON object" : parseError);
            ObjectNode failed = StatusDocuments.terminal(runId, request.mode(), request.files(),
                    SupervisedStatus.FAILED, startedAt, finishedAt, error);
            failed.put(StatusDocuments.EXIT_CODE, exitCode);
            putTails(failed, stdoutFile, stderrFile);
            return failed;
        }

        JsonNode reported = doc.get(StatusDocuments.RUN_ID);
        if (reported != null && !runId.equals(reported.asText())) {
            log.warn("worker reported run_id={} for supervised run_id={}, overriding", reported.asText(), runId);
        }
        doc.put(StatusDocuments.RUN_ID, runId);
        if (!doc.hasNonNull(StatusDocuments.REQUESTED_MODE)) {
            doc.put(StatusDocuments.REQUESTED_MODE, request.mode().cliValue());
        }
        if (!doc.hasNonNull(StatusDocuments.STARTED_AT)) {
            doc.put(StatusDocuments.STARTED_AT, startedAt.toString());
        }
        if (!doc.hasNonNull(StatusDocuments.FINISHED_AT)) {
            doc.put(StatusDocuments.FINISHED_AT, finishedAt.toString());
        }
        if (!doc.hasNonNull(StatusDocuments.DURATION_MS)) {
            doc.put(StatusDocuments.DURATION_MS, Duration.between(startedAt, finishedAt).toMillis());
        }
        if (!doc.has(StatusDocuments.FILES)) {
            doc.putArray(StatusDocuments.FILES);
        }
        if (!doc.hasNonNull(StatusDocuments.SUMMARY)) {
            doc.set(StatusDocuments.SUMMARY, StatusDocuments.minimalSummary(request.files().size()));
        }
        doc.put(StatusDocuments.EXIT_CODE, exitCode);

        SupervisedStatus status = StatusDocuments.status(doc);
        JsonNode rawStatus = doc.get(StatusDocuments.STATUS);
        boolean validStatus = rawStatus != null && rawStatus.isTextual()
                && status.name().equalsIgnoreCase(rawStatus.asText().trim());
        if (!validStatus || status == SupervisedStatus.RUNNING) {
            doc.put(StatusDocuments.STATUS, SupervisedStatus.FAILED.name());
            doc.put(StatusDocuments.ERROR, "Worker result has no terminal status: " + rawStatus);
            status = SupervisedStatus.FAILED;
        }
        if (status != SupervisedStatus.OK && status != SupervisedStatus.OK_WITH_SKIPS) {
            String stderrTail = StatusDocuments.tail(readQuietly(stderrFile), tailChars);
            if (stderrTail != null) {
                doc.put(StatusDocuments.STDERR_TAIL, stderrTail);
            }
        }
        return doc;
    }

    /**
     * Graceful signal, grace period, then forced kill of the child and every descendant.
     * Returns whether anything is still alive afterwards.
     */
    private boolean terminate(Process process) {
        List<ProcessHandle> tree = new ArrayList<>(process.descendants().toList());
        process.destroy();
        tree.forEach(ProcessHandle::destroy);
        boolean exited = awaitExit(process, killGrace);
        tree.addAll(process.descendants().toList());
        if (!exited) {
            log.warn("worker ignored graceful termination, forcing kill pid={}", process.pid());
            process.destroyForcibly();
        }
        for (ProcessHandle h : tree) {
            if (h.isAlive()) {
                h.destroyForcibly();
            }
        }
        awaitExit(process, FORCE_KILL_WAIT);
        long deadline = System.nanoTime() + FORCE_KILL_WAIT.toNanos();
        while (System.nanoTime() < deadline && tree.stream().anyMatch(ProcessHandle::isAlive)) {
            sleepBriefly();
        }
        return process.isAlive() || tree.stream().anyMatch(ProcessHandle::isAlive);
    }

    private static boolean awaitExit(Process process, Duration wait) {
        try {
            return process.waitFor(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !process.isAlive();
        }
    }

    private static void sleepBriefly() {
        try {
            Thread.sleep(50L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void putTails(ObjectNode doc, Path stdoutFile, Path stderrFile) {
        String out = StatusDocuments.tail(readQuietly(stdoutFile), tailChars);
        String err = StatusDocuments.tail(readQuietly(stderrFile), tailChars);
        if (out != null) {
            doc.put(StatusDocuments.STDOUT_TAIL, out);
        }
        if (err != null) {
            doc.put(StatusDocuments.STDERR_TAIL, err);
        }
    }

    private static String readQuietly(Path file) {
        try {
            return Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : "";
        } catch (IOException e) {
            log.warn("failed to read worker output {}", file, e);
            return "";
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("failed to delete worker output {}", file, e);
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout.plus(killGrace).plus(FORCE_KILL_WAIT).toMillis(),
                    TimeUnit.MILLISECONDS)) {
                log.warn("supervisor threads still running at close");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public record Handle(String runId, Future<ObjectNode> completion) {
        public ObjectNode await() {
            try {
                return completion.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted waiting for run " + runId, e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Supervision failed for run " + runId, e.getCause());
            }
        }
    }
}
