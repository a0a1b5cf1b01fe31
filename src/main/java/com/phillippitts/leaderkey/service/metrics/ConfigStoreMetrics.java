package com.phillippitts.leaderkey.service.metrics;

import com.phillippitts.leaderkey.service.config.ConflictResolution;
import com.phillippitts.leaderkey.service.config.SaveResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Counters for config store activity.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Loads by outcome (success, failure)</li>
 *   <li>Save attempts by result</li>
 *   <li>Save conflicts by resolution</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class ConfigStoreMetrics {

    private static final String METRIC_PREFIX = "leaderkey.config";

    private final MeterRegistry registry;

    public ConfigStoreMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param success whether the file was read and decoded
     */
    public void recordLoad(boolean success) {
        Counter.builder(METRIC_PREFIX + ".loads")
                .description("Number of config loads")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordSave(SaveResult result) {
        Counter.builder(METRIC_PREFIX + ".saves")
                .description("Number of config save attempts by result")
                .tag("result", result.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordConflict(ConflictResolution resolution) {
        Counter.builder(METRIC_PREFIX + ".conflicts")
                .description("Number of save conflicts by chosen resolution")
                .tag("resolution", resolution.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
