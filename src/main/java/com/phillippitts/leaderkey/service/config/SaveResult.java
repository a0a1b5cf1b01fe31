package com.phillippitts.leaderkey.service.config;

/**
 * Outcome of one save attempt.
 */
public enum SaveResult {
    WRITTEN,
    /** Conflict answered with Cancel. */
    CANCELLED,
    /** Conflict answered with Read from file; a reload was started instead of writing. */
    RELOADED,
    /** Nothing to write: loading, error placeholder, or another save is in progress. */
    SKIPPED,
    FAILED
}
