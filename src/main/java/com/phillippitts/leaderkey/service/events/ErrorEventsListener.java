package com.phillippitts.leaderkey.service.events;

import com.phillippitts.leaderkey.service.config.event.ConfigConflictEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigDirectoryResetEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigLoadFailedEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigWriteFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing config errors. Throttled to avoid log spam when the
 * same file keeps failing.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onLoadFailed(ConfigLoadFailedEvent e) {
        if (shouldLog("load-failed-" + e.file())) {
            LOG.error("Config file {} could not be loaded: {}. Fix the file and reload; "
                    + "it will not be overwritten meanwhile.", e.file(), e.reason());
        }
    }

    @EventListener
    void onWriteFailed(ConfigWriteFailedEvent e) {
        if (shouldLog("write-failed-" + e.file())) {
            LOG.error("Config file {} could not be written: {}. Changes are kept in memory.",
                    e.file(), e.reason());
        }
    }

    @EventListener
    void onDirectoryReset(ConfigDirectoryResetEvent e) {
        if (shouldLog("directory-reset-" + e.missingDirectory())) {
            LOG.warn("Config directory does not exist: {}. Resetting to default location {}.",
                    e.missingDirectory(), e.fallbackDirectory());
        }
    }

    @EventListener
    void onConflict(ConfigConflictEvent e) {
        if (shouldLog("conflict-" + e.file() + '-' + e.resolution())) {
            LOG.warn("Config file {} was changed outside the app; save resolved with {}.",
                    e.file(), e.resolution());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
