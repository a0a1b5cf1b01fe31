package com.phillippitts.leaderkey.exception;

import java.nio.file.Path;

/**
 * Thrown when the config file exists but cannot be read.
 */
public class ConfigReadException extends LeaderKeyException {

    private final Path path;

    public ConfigReadException(Path path, Throwable cause) {
        super("Failed to read config file: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
