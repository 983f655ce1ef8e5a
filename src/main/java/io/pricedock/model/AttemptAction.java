package io.pricedock.model;

public enum AttemptAction {
    START,
    SKIP_ALREADY_SUCCESS,
    SKIP_ALREADY_RUNNING,
    RETRY_AFTER_FAILED;

    public boolean skip() {
        return this == SKIP_ALREADY_SUCCESS || this == SKIP_ALREADY_RUNNING;
    }
}
