package com.phillippitts.leaderkey.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Node kinds as they appear in the {@code type} field of the config file.
 */
public enum ActionType {
    GROUP("group"),
    APPLICATION("application"),
    URL("url"),
    COMMAND("command"),
    FOLDER("folder"),
    FILE("file"),
    SCRIPT("script");

    private final String jsonName;

    ActionType(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }

    /**
     * Looks up a type by its file representation. Matching is exact apart from case.
     */
    public static Optional<ActionType> fromJsonName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (ActionType t : values()) {
            if (t.jsonName.equals(n)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
