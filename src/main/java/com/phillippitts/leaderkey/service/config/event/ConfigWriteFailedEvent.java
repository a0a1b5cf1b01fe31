package com.phillippitts.leaderkey.service.config.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published when writing the config file or its directory failed. The in-memory tree is kept.
 */
public record ConfigWriteFailedEvent(Path file, String reason, Instant at) { }
