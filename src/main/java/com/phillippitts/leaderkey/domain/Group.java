package com.phillippitts.leaderkey.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Internal node holding an ordered list of children. Child order is display order and
 * dispatch precedence (first match wins).
 *
 * <p>Edits never mutate a group; {@code with*} methods return a copy that keeps the
 * same {@code id}, so selection can follow a group across edits.
 */
public record Group(UUID id,
                    String key,
                    String label,
                    String iconPath,
                    List<Node> children) implements Node {

    /** Key of the placeholder root installed when the config file cannot be decoded. */
    public static final String ERROR_KEY = "🚫";
    public static final String ERROR_LABEL = "Config error";

    public Group {
        id = id == null ? UUID.randomUUID() : id;
        label = label == null || label.isBlank() ? null : label;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static Group of(String key, String label, Node... children) {
        return new Group(null, key, label, null, Arrays.asList(children));
    }

    public static Group root(List<? extends Node> children) {
        return new Group(null, null, null, null, new ArrayList<>(children));
    }

    public static Group emptyRoot() {
        return new Group(null, null, null, null, List.of());
    }

    public static Group errorSentinel() {
        return new Group(null, ERROR_KEY, ERROR_LABEL, null, List.of());
    }

    @Override
    public ActionType type() {
        return ActionType.GROUP;
    }

    @Override
    public String displayName() {
        return label == null ? "Group" : label;
    }

    public Group withChildren(List<? extends Node> newChildren) {
        return new Group(id, key, label, iconPath, new ArrayList<>(newChildren));
    }

    public Group withLabel(String newLabel) {
        return new Group(id, key, newLabel, iconPath, children);
    }

    public Group withKey(String newKey) {
        return new Group(id, newKey, label, iconPath, children);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Group other)) {
            return false;
        }
        return Objects.equals(KeyGlyphs.toGlyph(key), KeyGlyphs.toGlyph(other.key))
                && Objects.equals(label, other.label)
                && Objects.equals(iconPath, other.iconPath)
                && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(KeyGlyphs.toGlyph(key), label, iconPath, children);
    }
}
