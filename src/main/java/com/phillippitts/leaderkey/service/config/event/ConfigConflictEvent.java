package com.phillippitts.leaderkey.service.config.event;

import com.phillippitts.leaderkey.service.config.ConflictResolution;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published when a save found the file changed on disk since it was last read.
 */
public record ConfigConflictEvent(Path file, ConflictResolution resolution, Instant at) { }
