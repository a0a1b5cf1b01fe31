package com.phillippitts.leaderkey.service.config.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published before an explicit reload from disk starts.
 */
public record ConfigReloadingEvent(Path file, Instant at) { }
