package com.phillippitts.leaderkey.config.navigation;

import com.phillippitts.leaderkey.service.keys.Modifier;

import java.util.Set;

/**
 * Assigns the two modifier capabilities to physical keys.
 * <p>
 * Spring Boot relaxed binding maps property values like "control-group-option-sticky"
 * to CONTROL_GROUP_OPTION_STICKY.
 */
public enum ModifierKeyConfiguration {
    /** Control runs a whole group, Option keeps the menu open. */
    CONTROL_GROUP_OPTION_STICKY(Modifier.CONTROL, Modifier.OPTION),
    /** Option runs a whole group, Control keeps the menu open. */
    OPTION_GROUP_CONTROL_STICKY(Modifier.OPTION, Modifier.CONTROL);

    private final Modifier groupRunModifier;
    private final Modifier stickyModifier;

    ModifierKeyConfiguration(Modifier groupRunModifier, Modifier stickyModifier) {
        this.groupRunModifier = groupRunModifier;
        this.stickyModifier = stickyModifier;
    }

    public Modifier groupRunModifier() {
        return groupRunModifier;
    }

    public Modifier stickyModifier() {
        return stickyModifier;
    }

    public boolean isGroupRun(Set<Modifier> modifiers) {
        return modifiers != null && modifiers.contains(groupRunModifier);
    }

    public boolean isSticky(Set<Modifier> modifiers) {
        return modifiers != null && modifiers.contains(stickyModifier);
    }
}
