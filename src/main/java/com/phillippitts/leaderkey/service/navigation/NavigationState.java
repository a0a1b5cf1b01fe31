package com.phillippitts.leaderkey.service.navigation;

import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.GroupRef;
import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.service.config.ConfigTreeEditor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Selection and traversal state of the menu.
 *
 * <p>The path is kept as a list of group snapshots, but every read re-resolves it against
 * the current tree by {@code (key, label)}, so a reload never leaves the menu pointing at
 * stale children. When the path no longer resolves the stored snapshot is used for reads.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * navigateToGroup(g): push selection, append g, selection cleared
 * goBack():           pop g, restore the selection held before entering g
 * moveSelection(d):   none → first (d &gt; 0) or last (d &lt; 0); otherwise wrap modulo size
 * clear():            empty path, no selection, no history, no display
 * </pre>
 *
 * <p><b>Thread Safety:</b> not thread-safe. {@link NavigationEngine} serializes access.
 */
public final class NavigationState {

    private final Supplier<Group> rootSupplier;
    private final List<Group> navigationPath = new ArrayList<>();
    private final List<Integer> selectionHistory = new ArrayList<>();
    private Integer selectedIndex;
    private String display;

    /**
     * @param rootSupplier current canonical tree; may supply {@code null} when no tree is loaded
     */
    public NavigationState(Supplier<Group> rootSupplier) {
        if (rootSupplier == null) {
            throw new NullPointerException("rootSupplier cannot be null");
        }
        this.rootSupplier = rootSupplier;
    }

    /**
     * Group whose children are listed: the root at the top level, otherwise the last path
     * element resolved against the current tree (or its snapshot if it no longer resolves).
     *
     * @return current group, or {@code null} when there is no tree
     */
    public Group currentGroup() {
        Group root = rootSupplier.get();
        if (navigationPath.isEmpty()) {
            return root;
        }
        return ConfigTreeEditor.resolve(root, pathRefs())
                .orElse(navigationPath.get(navigationPath.size() - 1));
    }

    /** Children of {@link #currentGroup()}; empty when there is no tree. */
    public List<Node> currentActions() {
        Group current = currentGroup();
        return current == null ? List.of() : current.children();
    }

    /** Item at the selected index, checked against the current list on every call. */
    public Optional<Node> selectedItem() {
        if (selectedIndex == null) {
            return Optional.empty();
        }
        List<Node> actions = currentActions();
        int i = selectedIndex;
        if (i < 0 || i >= actions.size()) {
            return Optional.empty();
        }
        return Optional.of(actions.get(i));
    }

    public Optional<Integer> selectedIndex() {
        return Optional.ofNullable(selectedIndex);
    }

    /** Sets the selection without bounds checking; reads check bounds. */
    public void setSelectedIndex(Integer index) {
        this.selectedIndex = index;
    }

    public boolean isAtRoot() {
        return navigationPath.isEmpty();
    }

    /** True when every path element still exists in the current tree. */
    public boolean isPathResolvable() {
        return navigationPath.isEmpty() || ConfigTreeEditor.resolve(rootSupplier.get(), pathRefs()).isPresent();
    }

    public List<Group> navigationPath() {
        return List.copyOf(navigationPath);
    }

    public List<GroupRef> pathRefs() {
        return ConfigTreeEditor.refsOf(navigationPath);
    }

    /** Selections saved on descent; entries may be {@code null}. */
    public List<Integer> selectionHistory() {
        return Collections.unmodifiableList(new ArrayList<>(selectionHistory));
    }

    public String display() {
        return display;
    }

    public void setDisplay(String display) {
        this.display = display;
    }

    public void navigateToGroup(Group group) {
        if (group == null) {
            throw new NullPointerException("group cannot be null");
        }
        selectionHistory.add(selectedIndex);
        navigationPath.add(group);
        selectedIndex = null;
    }

    /**
     * @return {@code false} when already at the root
     */
    public boolean goBack() {
        if (navigationPath.isEmpty()) {
            return false;
        }
        navigationPath.remove(navigationPath.size() - 1);
        selectedIndex = selectionHistory.isEmpty() ? null : selectionHistory.remove(selectionHistory.size() - 1);
        return true;
    }

    public void moveSelection(int delta) {
        int count = currentActions().size();
        if (count == 0) {
            return;
        }
        if (selectedIndex == null) {
            selectedIndex = delta > 0 ? 0 : count - 1;
            return;
        }
        selectedIndex = Math.floorMod(selectedIndex + delta, count);
    }

    public void clear() {
        navigationPath.clear();
        selectionHistory.clear();
        selectedIndex = null;
        display = null;
    }
}
