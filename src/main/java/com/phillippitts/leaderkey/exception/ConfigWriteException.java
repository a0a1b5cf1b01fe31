package com.phillippitts.leaderkey.exception;

import java.nio.file.Path;

/**
 * Thrown when the config file or its directory cannot be written.
 * The in-memory tree is kept when this happens.
 */
public class ConfigWriteException extends LeaderKeyException {

    private final Path path;

    public ConfigWriteException(Path path, Throwable cause) {
        super("Failed to write config file: " + path, cause);
        this.path = path;
    }

    public ConfigWriteException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
