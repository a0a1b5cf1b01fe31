package com.phillippitts.leaderkey.service.config.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published after the config file was written atomically.
 */
public record ConfigSavedEvent(Path file, String checksum, Instant at) { }
