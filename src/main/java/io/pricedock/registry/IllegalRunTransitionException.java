package io.pricedock.registry;

import io.pricedock.model.ImportRunStatus;

import java.util.Set;
import java.util.TreeSet;

public final class IllegalRunTransitionException extends RuntimeException {
    private final String runId;
    private final Set<ImportRunStatus> expected;
    private final String actual;

    public IllegalRunTransitionException(String runId, Set<ImportRunStatus> expected, String actual) {
        super("Illegal transition for run " + runId + ": expected status in " + names(expected)
                + ", actual=" + actual);
        this.runId = runId;
        this.expected = Set.copyOf(expected);
        this.actual = actual;
    }

    public String runId() {
        return runId;
    }

    public Set<ImportRunStatus> expected() {
        return expected;
    }

    /**
     * Status found in the ledger, or {@code "missing"} when the run does not exist.
     */
    public String actual() {
        return actual;
    }

    private static Set<String> names(Set<ImportRunStatus> statuses) {
        Set<String> out = new TreeSet<>();
        for (ImportRunStatus s : statuses) {
            out.add(s.dbValue());
        }
        return out;
    }
}
