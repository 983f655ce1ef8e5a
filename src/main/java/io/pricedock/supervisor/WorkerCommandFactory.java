package io.pricedock.supervisor;

import java.util.List;

/**
 * Builds the child process command line for one supervised run.
 */
@FunctionalInterface
public interface WorkerCommandFactory {
    List<String> command(SupervisedRequest request);
}
