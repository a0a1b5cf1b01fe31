package com.phillippitts.leaderkey.config.properties;

import com.phillippitts.leaderkey.config.navigation.ModifierKeyConfiguration;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for menu navigation.
 */
@Validated
@ConfigurationProperties(prefix = "leaderkey.navigation")
public class NavigationProperties {

    /** Which physical modifier runs a whole group and which keeps the menu open. */
    @NotNull
    private final ModifierKeyConfiguration modifierConfiguration;

    @ConstructorBinding
    public NavigationProperties(ModifierKeyConfiguration modifierConfiguration) {
        this.modifierConfiguration = modifierConfiguration == null
                ? ModifierKeyConfiguration.CONTROL_GROUP_OPTION_STICKY
                : modifierConfiguration;
    }

    public ModifierKeyConfiguration getModifierConfiguration() {
        return modifierConfiguration;
    }
}
