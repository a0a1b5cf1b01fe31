package com.phillippitts.leaderkey.service.config.event;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Published when the configured directory was missing and the store fell back to the default one.
 */
public record ConfigDirectoryResetEvent(Path missingDirectory, Path fallbackDirectory, Instant at) { }
