package io.pricedock.supervisor;

import io.pricedock.model.ImportMode;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs {@code daily-import} in a fresh JVM on the current classpath.
 */
public final class JavaWorkerCommandFactory implements WorkerCommandFactory {
    static final String MAIN_CLASS = "io.pricedock.Main";

    private final Path root;
    private final String target;

    public JavaWorkerCommandFactory(Path root, String target) {
        this.root = root;
        this.target = target;
    }

    @Override
    public List<String> command(SupervisedRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        cmd.add("-cp");
        cmd.add(System.getProperty("java.class.path"));
        cmd.add(MAIN_CLASS);
        cmd.add("--root");
        cmd.add(root.toString());
        cmd.add("daily-import");
        cmd.add("--mode");
        cmd.add(request.mode().cliValue());
        cmd.add("--run-id");
        cmd.add(request.runId());
        cmd.add("--no-status-file");
        if (target != null && !target.isBlank()) {
            cmd.add("--target");
            cmd.add(target);
        }
        if (request.mode() == ImportMode.FILES) {
            cmd.add("--files");
            cmd.addAll(request.files());
        }
        return cmd;
    }
}
