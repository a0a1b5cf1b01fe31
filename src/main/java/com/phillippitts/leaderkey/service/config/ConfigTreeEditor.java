package com.phillippitts.leaderkey.service.config;

import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.domain.ActionType;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.GroupRef;
import com.phillippitts.leaderkey.domain.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Copy-on-write edits of the configuration tree.
 *
 * <p>Every operation locates its target group by walking {@code path} from the root,
 * matching each level by {@link GroupRef} (first match in child order). If any level no
 * longer resolves the operation returns {@link Optional#empty()} and the tree is left alone.
 * Untouched subtrees are shared between the old and new root and surviving nodes keep their ids.
 *
 * <p>A path through a group with neither key nor label is ambiguous. That is warned about once
 * per tree and logged at debug level afterwards, since navigation re-resolves its path on every
 * key press.
 */
public final class ConfigTreeEditor {

    private static final Logger LOG = LogManager.getLogger(ConfigTreeEditor.class);

    // Last tree an ambiguous path was warned about; compared by identity
    private static volatile Group lastAmbiguousRoot;

    private ConfigTreeEditor() {}

    /** The group addressed by {@code path}; the root for an empty path. */
    public static Optional<Group> resolve(Group root, List<GroupRef> path) {
        if (root == null) {
            return Optional.empty();
        }
        reportAmbiguity(root, path);
        Group current = root;
        for (GroupRef ref : path) {
            Optional<Group> next = findGroup(current, ref);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    public static Optional<Group> appendChild(Group root, List<GroupRef> path, Node child) {
        return update(root, path, 0, g -> {
            List<Node> children = new ArrayList<>(g.children());
            children.add(child);
            return Optional.of(g.withChildren(children));
        });
    }

    /**
     * Inserts {@code node} right after {@code sibling} in the group at {@code path}.
     * The sibling is found by id first, then by structural equality, so the call still
     * works after the tree was reloaded from disk.
     */
    public static Optional<Group> insertAfter(Group root, List<GroupRef> path, Node sibling, Node node) {
        return update(root, path, 0, g -> {
            int index = indexOf(g.children(), sibling);
            if (index < 0) {
                return Optional.empty();
            }
            List<Node> children = new ArrayList<>(g.children());
            children.add(index + 1, node);
            return Optional.of(g.withChildren(children));
        });
    }

    /** Removes {@code target} from the group at {@code path}; matched like {@link #insertAfter}. */
    public static Optional<Group> remove(Group root, List<GroupRef> path, Node target) {
        return update(root, path, 0, g -> {
            int index = indexOf(g.children(), target);
            if (index < 0) {
                return Optional.empty();
            }
            List<Node> children = new ArrayList<>(g.children());
            children.remove(index);
            return Optional.of(g.withChildren(children));
        });
    }

    /** Replaces the group at {@code path} (the whole tree for an empty path). */
    public static Optional<Group> replaceSubtree(Group root, List<GroupRef> path, Group replacement) {
        return update(root, path, 0, g -> Optional.of(replacement));
    }

    /** Values of every action of the given kinds, in depth-first order without duplicates. */
    public static Set<String> actionValues(Group root, Set<ActionType> types) {
        Set<String> values = new LinkedHashSet<>();
        if (root == null) {
            return values;
        }
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node instanceof Group group) {
                List<Node> children = group.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            } else if (node instanceof Action action && types.contains(action.type())) {
                values.add(action.value());
            }
        }
        return values;
    }

    /** Path of {@link GroupRef}s describing a chain of groups below the root. */
    public static List<GroupRef> refsOf(List<Group> groups) {
        List<GroupRef> refs = new ArrayList<>(groups.size());
        for (Group g : groups) {
            refs.add(GroupRef.of(g));
        }
        return refs;
    }

    private static Optional<Group> update(Group group,
                                          List<GroupRef> path,
                                          int depth,
                                          Function<Group, Optional<Group>> change) {
        if (group == null) {
            return Optional.empty();
        }
        if (depth == 0) {
            reportAmbiguity(group, path);
        }
        if (depth == path.size()) {
            return change.apply(group);
        }
        GroupRef ref = path.get(depth);
        List<Node> children = group.children();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) instanceof Group child && ref.matches(child)) {
                Optional<Group> updated = update(child, path, depth + 1, change);
                if (updated.isEmpty()) {
                    return Optional.empty();
                }
                List<Node> copy = new ArrayList<>(children);
                copy.set(i, updated.get());
                return Optional.of(group.withChildren(copy));
            }
        }
        return Optional.empty();
    }

    private static void reportAmbiguity(Group root, List<GroupRef> path) {
        if (path.stream().noneMatch(GroupRef::isAmbiguous)) {
            return;
        }
        if (lastAmbiguousRoot != root) {
            lastAmbiguousRoot = root;
            LOG.warn("Path goes through a group with neither key nor label; first match in child order wins");
        } else {
            LOG.debug("Resolving ambiguous path; first match in child order wins");
        }
    }

    private static Optional<Group> findGroup(Group parent, GroupRef ref) {
        for (Node child : parent.children()) {
            if (child instanceof Group g && ref.matches(g)) {
                return Optional.of(g);
            }
        }
        return Optional.empty();
    }

    private static int indexOf(List<Node> children, Node target) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).id().equals(target.id())) {
                return i;
            }
        }
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).equals(target)) {
                return i;
            }
        }
        return -1;
    }
}
