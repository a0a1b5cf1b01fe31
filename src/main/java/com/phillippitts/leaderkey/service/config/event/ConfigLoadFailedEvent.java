package com.phillippitts.leaderkey.service.config.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published when the config file could not be read or decoded. The canonical tree is the
 * error placeholder until the file is fixed and reloaded.
 */
public record ConfigLoadFailedEvent(Path file, String reason, Instant at) { }
