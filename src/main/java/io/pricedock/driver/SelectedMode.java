package io.pricedock.driver;

import io.pricedock.model.ImportMode;

public enum SelectedMode {
    AUTO_INBOX_NEWEST,
    MANUAL_LIST;

    public static SelectedMode of(ImportMode mode) {
        return mode == ImportMode.FILES ? MANUAL_LIST : AUTO_INBOX_NEWEST;
    }
}
