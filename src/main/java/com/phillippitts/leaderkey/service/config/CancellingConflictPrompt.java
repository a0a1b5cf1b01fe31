package com.phillippitts.leaderkey.service.config;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Prompt used when no interactive UI is attached: keeps both sides untouched.
 * A client resolves the conflict later with an explicit reload or overwrite.
 */
public class CancellingConflictPrompt implements ConflictPrompt {

    private static final Logger LOG = LogManager.getLogger(CancellingConflictPrompt.class);

    @Override
    public ConflictResolution askOverwriteCancelReload(Path file) {
        LOG.warn("{}: {}. Save cancelled; reload or overwrite explicitly to resolve.", TITLE, file);
        return ConflictResolution.CANCEL;
    }
}
