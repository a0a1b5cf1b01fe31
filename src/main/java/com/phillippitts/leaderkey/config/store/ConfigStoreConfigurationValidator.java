package com.phillippitts.leaderkey.config.store;

import com.phillippitts.leaderkey.config.properties.ConfigStoreProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Validates ConfigStoreProperties at startup to fail fast with actionable messages.
 */
@Component
class ConfigStoreConfigurationValidator {

    private final ConfigStoreProperties props;

    ConfigStoreConfigurationValidator(ConfigStoreProperties props) {
        this.props = props;
    }

    @PostConstruct
    void validate() {
        String fileName = props.getFileName();
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("leaderkey.config.file-name must not be blank");
        }
        if (fileName.contains("/") || fileName.contains("\\")) {
            throw new IllegalArgumentException("Invalid leaderkey.config.file-name: '" + fileName
                    + "'. Must be a plain file name; set leaderkey.config.directory for the location.");
        }
        if (!fileName.endsWith(".json")) {
            throw new IllegalArgumentException("Invalid leaderkey.config.file-name: '" + fileName
                    + "'. The config file is JSON and must end with .json");
        }
        requirePath("leaderkey.config.directory", props.getDirectory());
        requirePath("leaderkey.config.default-directory", props.getDefaultDirectory());
        int debounce = props.getDebounceMs();
        if (debounce < 50 || debounce > 5000) {
            throw new IllegalArgumentException(
                    "Save debounce must be between 50 and 5000 milliseconds, got: " + debounce);
        }
    }

    private static void requirePath(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(property + " must not be blank");
        }
        try {
            Path.of(value);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid " + property + ": '" + value + "'", e);
        }
    }
}
