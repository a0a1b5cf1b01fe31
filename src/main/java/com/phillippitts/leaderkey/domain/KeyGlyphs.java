package com.phillippitts.leaderkey.domain;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Fixed table of special keys. In memory and on screen a special key is a glyph,
 * in the config file it is written as its text name. Decoding accepts either form.
 */
public final class KeyGlyphs {

    private static final Map<String, String> TEXT_TO_GLYPH;
    private static final Map<String, String> GLYPH_TO_TEXT;

    static {
        Map<String, String> t = new LinkedHashMap<>();
        t.put("enter", "↩");
        t.put("space", "␣");
        t.put("tab", "⇥");
        t.put("left", "←");
        t.put("right", "→");
        t.put("up", "↑");
        t.put("down", "↓");
        t.put("backspace", "⌫");
        t.put("escape", "⎋");
        TEXT_TO_GLYPH = Map.copyOf(t);

        Map<String, String> g = new LinkedHashMap<>();
        t.forEach((text, glyph) -> g.put(glyph, text));
        GLYPH_TO_TEXT = Map.copyOf(g);
    }

    private KeyGlyphs() {}

    /** Glyph for a special-key text name (case-insensitive), or for the glyph itself. */
    public static Optional<String> glyphFor(String key) {
        if (key == null) {
            return Optional.empty();
        }
        if (GLYPH_TO_TEXT.containsKey(key)) {
            return Optional.of(key);
        }
        return Optional.ofNullable(TEXT_TO_GLYPH.get(key.trim().toLowerCase(Locale.ROOT)));
    }

    /** Text name for a glyph (or for a text name in any case). */
    public static Optional<String> textFor(String key) {
        return glyphFor(key).map(GLYPH_TO_TEXT::get);
    }

    public static boolean isSpecialKey(String key) {
        return glyphFor(key).isPresent();
    }

    /**
     * Canonical in-memory form: glyph for special keys, the key unchanged otherwise.
     * Null stays null.
     */
    public static String toGlyph(String key) {
        return glyphFor(key).orElse(key);
    }

    /** Form written to the config file: text name for special keys, the key unchanged otherwise. */
    public static String toText(String key) {
        return textFor(key).orElse(key);
    }
}
