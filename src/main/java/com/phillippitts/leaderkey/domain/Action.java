package com.phillippitts.leaderkey.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Leaf node performing one effect: launch an application, open a URL, file or folder,
 * or run a command or script.
 *
 * <p>Equality covers every persisted field with keys compared in glyph form; {@code id}
 * is excluded.
 */
public record Action(UUID id,
                     String key,
                     ActionType type,
                     String label,
                     String value,
                     String iconPath,
                     String openWith,
                     List<ScriptArgument> arguments) implements Node {

    public Action {
        Objects.requireNonNull(type, "type must not be null");
        if (type == ActionType.GROUP) {
            throw new IllegalArgumentException("Action type must not be group");
        }
        id = id == null ? UUID.randomUUID() : id;
        label = label == null || label.isBlank() ? null : label;
        value = value == null ? "" : value;
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static Action of(String key, ActionType type, String value) {
        return new Action(null, key, type, null, value, null, null, List.of());
    }

    public static Action application(String key, String path) {
        return of(key, ActionType.APPLICATION, path);
    }

    public Action withLabel(String newLabel) {
        return new Action(id, key, type, newLabel, value, iconPath, openWith, arguments);
    }

    public Action withKey(String newKey) {
        return new Action(id, newKey, type, label, value, iconPath, openWith, arguments);
    }

    public Action withOpenWith(String newOpenWith) {
        return new Action(id, key, type, label, value, iconPath, newOpenWith, arguments);
    }

    public Action withArguments(List<ScriptArgument> newArguments) {
        return new Action(id, key, type, label, value, iconPath, openWith, newArguments);
    }

    @Override
    public String displayName() {
        if (label != null) {
            return label;
        }
        return switch (type) {
            case APPLICATION -> stripSuffix(lastPathComponent(value), ".app");
            case COMMAND -> firstWord(value);
            case FOLDER, FILE -> lastPathComponent(value);
            case SCRIPT -> stripSuffix(lastPathComponent(value), ".sh");
            case URL -> "URL";
            case GROUP -> throw new IllegalStateException("Action type must not be group");
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action other)) {
            return false;
        }
        return type == other.type
                && Objects.equals(KeyGlyphs.toGlyph(key), KeyGlyphs.toGlyph(other.key))
                && Objects.equals(label, other.label)
                && value.equals(other.value)
                && Objects.equals(iconPath, other.iconPath)
                && Objects.equals(openWith, other.openWith)
                && arguments.equals(other.arguments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, KeyGlyphs.toGlyph(key), label, value, iconPath, openWith, arguments);
    }

    private static String lastPathComponent(String path) {
        String trimmed = path;
        while (trimmed.length() > 1 && trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : trimmed;
    }

    private static String stripSuffix(String s, String suffix) {
        return s.endsWith(suffix) ? s.substring(0, s.length() - suffix.length()) : s;
    }

    private static String firstWord(String s) {
        String trimmed = s.trim();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        return trimmed.split("\\s+", 2)[0];
    }
}
