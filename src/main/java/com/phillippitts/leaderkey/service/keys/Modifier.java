package com.phillippitts.leaderkey.service.keys;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Physical modifier keys that can accompany a key press.
 */
public enum Modifier {
    COMMAND,
    CONTROL,
    OPTION,
    SHIFT;

    /**
     * Parses a modifier name. Accepts common aliases (CMD, META, CTRL, ALT), any case.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Modifier parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Modifier name must not be blank");
        }
        String m = name.trim().toUpperCase(Locale.ROOT);
        return switch (m) {
            case "COMMAND", "CMD", "META" -> COMMAND;
            case "CONTROL", "CTRL" -> CONTROL;
            case "OPTION", "OPT", "ALT" -> OPTION;
            case "SHIFT" -> SHIFT;
            default -> throw new IllegalArgumentException("Unknown modifier: '" + name
                    + "'. Allowed: COMMAND, CONTROL, OPTION, SHIFT (aliases CMD, META, CTRL, ALT)");
        };
    }

    /** Parses a list of modifier names; null yields an empty set. */
    public static Set<Modifier> parseAll(Collection<String> names) {
        Set<Modifier> result = EnumSet.noneOf(Modifier.class);
        if (names == null) {
            return result;
        }
        for (String n : names) {
            result.add(parse(n));
        }
        return result;
    }
}
