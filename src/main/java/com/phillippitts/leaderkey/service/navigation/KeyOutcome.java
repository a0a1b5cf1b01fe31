package com.phillippitts.leaderkey.service.navigation;

import com.phillippitts.leaderkey.domain.Node;

/**
 * What a key press did. {@code node} is the matched or selected node, when there is one.
 */
public record KeyOutcome(Kind kind, Node node) {

    public enum Kind {
        /** No child of the current group has this key; the UI shakes. */
        NOT_FOUND,
        DESCENDED,
        /** Action matched in preview mode; nothing was run. */
        PREVIEWED,
        RAN_ACTION,
        /** Action run with the sticky modifier; the menu stays open. */
        RAN_ACTION_STICKY,
        RAN_GROUP,
        SHOW_CHEATSHEET,
        SELECTION_MOVED,
        WENT_BACK,
        CLEARED,
        CLOSED,
        IGNORED
    }

    public static KeyOutcome of(Kind kind) {
        return new KeyOutcome(kind, null);
    }

    public static KeyOutcome of(Kind kind, Node node) {
        return new KeyOutcome(kind, node);
    }

    /** True when the menu should be hidden after this outcome. */
    public boolean closesMenu() {
        return kind == Kind.RAN_ACTION || kind == Kind.RAN_GROUP || kind == Kind.CLOSED;
    }
}
