package com.phillippitts.leaderkey.presentation.controller;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Body of {@code POST /api/navigation/keys}. {@code execute=false} previews without running actions.
 */
record KeyPressRequest(@NotBlank String key, List<String> modifiers, Boolean execute) {

    boolean shouldExecute() {
        return execute == null || execute;
    }
}
