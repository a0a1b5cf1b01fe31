package com.phillippitts.leaderkey.config.navigation;

import com.phillippitts.leaderkey.service.keys.Modifier;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ModifierKeyConfigurationTest {

    @Test
    void controlGroupOptionSticky() {
        ModifierKeyConfiguration config = ModifierKeyConfiguration.CONTROL_GROUP_OPTION_STICKY;

        assertThat(config.isGroupRun(Set.of(Modifier.CONTROL))).isTrue();
        assertThat(config.isSticky(Set.of(Modifier.OPTION))).isTrue();
        assertThat(config.isSticky(Set.of(Modifier.CONTROL))).isFalse();
    }

    @Test
    void optionGroupControlStickySwapsRoles() {
        ModifierKeyConfiguration config = ModifierKeyConfiguration.OPTION_GROUP_CONTROL_STICKY;

        assertThat(config.groupRunModifier()).isEqualTo(Modifier.OPTION);
        assertThat(config.stickyModifier()).isEqualTo(Modifier.CONTROL);
        assertThat(config.isGroupRun(Set.of(Modifier.CONTROL))).isFalse();
    }

    @Test
    void nullModifiersEnableNothing() {
        for (ModifierKeyConfiguration config : ModifierKeyConfiguration.values()) {
            assertThat(config.isGroupRun(null)).isFalse();
            assertThat(config.isSticky(null)).isFalse();
        }
    }
}
