package com.phillippitts.leaderkey.domain;

import java.util.Objects;

/**
 * Identifies a group by its {@code (key, label)} pair. Used to re-resolve a navigation
 * path against a tree that may have been replaced since the path was captured.
 *
 * <p>A reference with neither key nor label is ambiguous: it matches any unkeyed,
 * unlabeled group, and the first such group in child order wins.
 */
public record GroupRef(String key, String label) {

    public GroupRef {
        label = label == null || label.isBlank() ? null : label;
    }

    public static GroupRef of(Group group) {
        return new GroupRef(group.key(), group.label());
    }

    public boolean matches(Group group) {
        return Objects.equals(KeyGlyphs.toGlyph(key), KeyGlyphs.toGlyph(group.key()))
                && Objects.equals(label, group.label());
    }

    public boolean isAmbiguous() {
        return key == null && label == null;
    }
}
