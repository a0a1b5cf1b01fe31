package com.phillippitts.leaderkey.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for the config file location and save behavior.
 *
 * Values are validated on startup for fail-fast behavior.
 */
@Validated
@ConfigurationProperties(prefix = "leaderkey.config")
public class ConfigStoreProperties {

    static final String DEFAULT_DIRECTORY = System.getProperty("user.home") + "/.config/leader-key";

    /** Directory holding the config file. Falls back to default-directory if it vanished. */
    @NotBlank
    private final String directory;

    /** Directory used when the configured one does not exist. Created on demand. */
    @NotBlank
    private final String defaultDirectory;

    @NotBlank
    private final String fileName;

    /** Quiescence window (ms) after the last edit before the pending save is written. */
    @Min(50)
    @Max(5000)
    private final int debounceMs;

    private final boolean loadOnStartup;

    @ConstructorBinding
    public ConfigStoreProperties(String directory,
                                 String defaultDirectory,
                                 String fileName,
                                 Integer debounceMs,
                                 Boolean loadOnStartup) {
        this.directory = directory == null ? DEFAULT_DIRECTORY : directory;
        this.defaultDirectory = defaultDirectory == null ? DEFAULT_DIRECTORY : defaultDirectory;
        this.fileName = fileName == null ? "config.json" : fileName;
        this.debounceMs = debounceMs == null ? 300 : debounceMs;
        this.loadOnStartup = loadOnStartup == null || loadOnStartup;
    }

    public String getDirectory() {
        return directory;
    }

    public String getDefaultDirectory() {
        return defaultDirectory;
    }

    public String getFileName() {
        return fileName;
    }

    public int getDebounceMs() {
        return debounceMs;
    }

    public boolean isLoadOnStartup() {
        return loadOnStartup;
    }

    public Path directoryPath() {
        return Path.of(directory);
    }

    public Path defaultDirectoryPath() {
        return Path.of(defaultDirectory);
    }
}
