package com.phillippitts.leaderkey.domain;

import java.util.Objects;

/**
 * Named argument passed to a script action, with an optional default value.
 */
public record ScriptArgument(String name, String defaultValue) {

    public ScriptArgument {
        Objects.requireNonNull(name, "name must not be null");
    }

    public static ScriptArgument of(String name) {
        return new ScriptArgument(name, null);
    }
}
