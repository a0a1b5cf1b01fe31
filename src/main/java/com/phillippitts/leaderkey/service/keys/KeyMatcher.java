package com.phillippitts.leaderkey.service.keys;

import com.phillippitts.leaderkey.domain.KeyGlyphs;
import com.phillippitts.leaderkey.domain.Node;

import java.util.List;
import java.util.Optional;

/**
 * Compares typed keys against configured node keys.
 *
 * <p>Special keys are compared in glyph form, so {@code "enter"}, {@code "ENTER"} and
 * {@code "↩"} are the same key. Any other key is compared exactly: shifted letters are
 * distinct keys ({@code "a"} does not match {@code "A"}).
 */
public final class KeyMatcher {

    private KeyMatcher() {}

    /** Canonical comparison form of a key; {@code null} stays {@code null}. */
    public static String normalize(String key) {
        return KeyGlyphs.toGlyph(key);
    }

    public static boolean matches(String configured, String typed) {
        if (configured == null || typed == null) {
            return false;
        }
        return normalize(configured).equals(normalize(typed));
    }

    /**
     * First node in list order whose key matches. Later duplicates are never reached.
     */
    public static Optional<Node> firstMatch(List<? extends Node> nodes, String typed) {
        for (Node n : nodes) {
            if (matches(n.key(), typed)) {
                return Optional.of(n);
            }
        }
        return Optional.empty();
    }

    /** True for a single character (one code point) or a known special key. */
    public static boolean isValidKey(String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        return key.codePointCount(0, key.length()) == 1 || KeyGlyphs.isSpecialKey(key);
    }
}
