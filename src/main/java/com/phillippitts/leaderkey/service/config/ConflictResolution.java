package com.phillippitts.leaderkey.service.config;

/**
 * Answer to a save conflict: the file changed on disk since it was last read.
 */
public enum ConflictResolution {
    /** Write the in-memory tree over the external changes. */
    OVERWRITE,
    /** Abandon this save attempt; the in-memory tree stays as it is. */
    CANCEL,
    /** Discard in-memory changes and load the file from disk. */
    RELOAD
}
