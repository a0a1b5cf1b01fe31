package com.phillippitts.leaderkey.service.config;

import java.nio.file.Path;

/**
 * Asks the user how to resolve a save conflict. Invoked only from the save path,
 * on the main executor, at most once per save attempt.
 */
@FunctionalInterface
public interface ConflictPrompt {

    String TITLE = "Configuration file changed on disk";
    String MESSAGE = "The configuration file has been modified outside of the app. "
            + "Choose 'Read from File' to load the external changes, "
            + "or 'Overwrite' to save your current changes.";

    ConflictResolution askOverwriteCancelReload(Path file);
}
