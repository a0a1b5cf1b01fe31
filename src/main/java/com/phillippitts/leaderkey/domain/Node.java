package com.phillippitts.leaderkey.domain;

import java.util.UUID;

/**
 * A node of the configuration tree: either an {@link Action} leaf or a {@link Group}.
 *
 * <p>Nodes are immutable. The {@link #id()} is a process-local identity used to follow a node
 * across edits; it is never persisted and never takes part in equality.
 */
public interface Node {

    UUID id();

    /** Configured trigger key, or {@code null} when absent. */
    String key();

    /** Optional label, may be {@code null}. */
    String label();

    /** Optional icon reference, may be {@code null}. */
    String iconPath();

    ActionType type();

    /** Name shown to the user when listing this node. */
    String displayName();

    default boolean isGroup() {
        return type() == ActionType.GROUP;
    }
}
