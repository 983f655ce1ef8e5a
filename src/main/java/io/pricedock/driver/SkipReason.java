package io.pricedock.driver;

public enum SkipReason {
    ALREADY_IMPORTED_SAME_HASH,
    NO_FILES_IN_INBOX,
    INVALID_EXTENSION,
    OTHER
}
