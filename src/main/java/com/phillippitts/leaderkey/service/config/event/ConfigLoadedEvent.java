package com.phillippitts.leaderkey.service.config.event;

import com.phillippitts.leaderkey.domain.Group;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published on the main executor after a successful load replaced the canonical tree.
 */
public record ConfigLoadedEvent(Path file, Group root, int validationErrorCount, Instant at) { }
