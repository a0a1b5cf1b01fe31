package com.phillippitts.leaderkey.service.config.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published once an explicit reload from disk has been applied (or failed).
 */
public record ConfigReloadedEvent(Path file, boolean success, Instant at) { }
