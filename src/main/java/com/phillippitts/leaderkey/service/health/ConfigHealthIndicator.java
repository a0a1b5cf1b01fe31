package com.phillippitts.leaderkey.service.health;

import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.service.config.ConfigStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the configuration file.
 *
 * <p>DOWN while the config could not be loaded (the tree is the error placeholder).
 * Validation errors do not affect the status; their count is reported as a detail.
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class ConfigHealthIndicator implements HealthIndicator {

    private final ConfigStore store;

    public ConfigHealthIndicator(ConfigStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        Group root = store.root();
        boolean broken = store.isInErrorState();
        Health.Builder builder = broken ? Health.down() : Health.up();
        return builder
                .withDetail("file", store.configFile().toString())
                .withDetail("status", broken ? "Config not loaded" : "Config loaded")
                .withDetail("items", root.children().size())
                .withDetail("validationErrors", store.validationErrors().size())
                .withDetail("loading", store.isLoading())
                .build();
    }
}
