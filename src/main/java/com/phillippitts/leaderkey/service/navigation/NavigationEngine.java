package com.phillippitts.leaderkey.service.navigation;

import com.phillippitts.leaderkey.config.navigation.ModifierKeyConfiguration;
import com.phillippitts.leaderkey.config.properties.NavigationProperties;
import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.GroupRef;
import com.phillippitts.leaderkey.domain.KeyGlyphs;
import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.service.config.ConfigStore;
import com.phillippitts.leaderkey.service.config.event.ConfigLoadedEvent;
import com.phillippitts.leaderkey.service.dispatch.ActionDispatcher;
import com.phillippitts.leaderkey.service.keys.KeyMatcher;
import com.phillippitts.leaderkey.service.keys.Modifier;
import com.phillippitts.leaderkey.service.navigation.KeyOutcome.Kind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Turns key presses into menu navigation and dispatch decisions.
 *
 * <p>Keys are matched only against the children of the current group, first match in child
 * order. Matching an action runs it and closes the menu (or keeps it open with the sticky
 * modifier); matching a group descends into it (or runs all of it with the group-run
 * modifier). Which physical modifier does what comes from
 * {@code leaderkey.navigation.modifier-configuration}.
 *
 * <p>The engine never edits the tree itself: additions and deletions go through
 * {@link ConfigStore} with the path re-resolved against the current tree.
 */
@Service
public class NavigationEngine {

    private static final Logger LOG = LogManager.getLogger(NavigationEngine.class);

    static final String CHEATSHEET_KEY = "?";

    private final ConfigStore store;
    private final ActionDispatcher dispatcher;
    private final ModifierKeyConfiguration modifierConfiguration;
    private final NavigationState state;

    public NavigationEngine(ConfigStore store, ActionDispatcher dispatcher, NavigationProperties props) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.modifierConfiguration = props.getModifierConfiguration();
        this.state = new NavigationState(store::root);
    }

    /**
     * Matches {@code key} against the current group's children.
     *
     * @param execute {@code false} for preview: groups are entered but actions are not run
     */
    public synchronized KeyOutcome handleKey(String key, Set<Modifier> modifiers, boolean execute) {
        if (key == null || key.isEmpty()) {
            return KeyOutcome.of(Kind.IGNORED);
        }
        if (CHEATSHEET_KEY.equals(key)) {
            return KeyOutcome.of(Kind.SHOW_CHEATSHEET);
        }
        Optional<Node> hit = KeyMatcher.firstMatch(state.currentActions(), key);
        if (hit.isEmpty()) {
            LOG.debug("No item for key '{}' in current group", key);
            return KeyOutcome.of(Kind.NOT_FOUND);
        }
        return activate(hit.get(), modifiers, execute);
    }

    /**
     * Entry point for raw key presses: navigation keys (arrows, enter, space, backspace,
     * escape) act on the selection, anything else goes to {@link #handleKey}.
     * Presses with Command held belong to the surrounding UI and are ignored.
     */
    public synchronized KeyOutcome keyDown(String key, Set<Modifier> modifiers) {
        if (key == null || key.isEmpty()) {
            return KeyOutcome.of(Kind.IGNORED);
        }
        if (modifiers != null && modifiers.contains(Modifier.COMMAND)) {
            return KeyOutcome.of(Kind.IGNORED);
        }
        if (!KeyGlyphs.isSpecialKey(key)) {
            return handleKey(key, modifiers, true);
        }
        return switch (KeyGlyphs.toText(key)) {
            case "backspace" -> clear();
            case "escape" -> close();
            case "down", "space" -> moveSelection(1);
            case "up" -> moveSelection(-1);
            case "enter" -> executeSelectedItem(modifiers);
            case "right" -> enterSelectedGroup();
            case "left" -> goBack();
            default -> handleKey(key, modifiers, true);
        };
    }

    public synchronized void navigateToGroup(Group group) {
        state.navigateToGroup(group);
        state.setDisplay(group.key());
    }

    public synchronized KeyOutcome goBack() {
        if (!state.goBack()) {
            return KeyOutcome.of(Kind.IGNORED);
        }
        Group current = state.currentGroup();
        state.setDisplay(state.isAtRoot() || current == null ? null : current.key());
        return KeyOutcome.of(Kind.WENT_BACK, current);
    }

    public synchronized KeyOutcome moveSelection(int delta) {
        if (state.currentActions().isEmpty()) {
            return KeyOutcome.of(Kind.IGNORED);
        }
        state.moveSelection(delta);
        return KeyOutcome.of(Kind.SELECTION_MOVED, state.selectedItem().orElse(null));
    }

    public synchronized KeyOutcome clear() {
        state.clear();
        return KeyOutcome.of(Kind.CLEARED);
    }

    /** Hides the menu; the next activation starts at the root. */
    public synchronized KeyOutcome close() {
        state.clear();
        return KeyOutcome.of(Kind.CLOSED);
    }

    /** Runs the selected action, or enters (or runs) the selected group. */
    public synchronized KeyOutcome executeSelectedItem(Set<Modifier> modifiers) {
        Optional<Node> selected = state.selectedItem();
        if (selected.isEmpty()) {
            return KeyOutcome.of(Kind.IGNORED);
        }
        return activate(selected.get(), modifiers, true);
    }

    public synchronized KeyOutcome enterSelectedGroup() {
        Optional<Node> selected = state.selectedItem();
        if (selected.isPresent() && selected.get() instanceof Group group) {
            navigateToGroup(group);
            return KeyOutcome.of(Kind.DESCENDED, group);
        }
        return KeyOutcome.of(Kind.IGNORED);
    }

    /**
     * Removes the selected item from the current group of the current tree.
     *
     * @return {@code false} when nothing is selected or the path no longer resolves
     */
    public synchronized boolean deleteSelectedItem() {
        Optional<Node> selected = state.selectedItem();
        if (selected.isEmpty()) {
            return false;
        }
        if (!state.isPathResolvable()) {
            LOG.warn("Navigation path no longer exists in the current config; delete aborted");
            return false;
        }
        boolean removed = store.delete(state.pathRefs(), selected.get());
        if (!removed) {
            LOG.warn("Selected item '{}' not found in the current config; delete aborted",
                    selected.get().displayName());
            return false;
        }
        int remaining = state.currentActions().size();
        state.selectedIndex().ifPresent(i -> state.setSelectedIndex(remaining == 0 ? null : Math.min(i, remaining - 1)));
        return true;
    }

    /**
     * Adds an action relative to the selection: into a selected group, after a selected
     * action, or at the end of the current group. Falls back to the root with a warning
     * when the current location no longer exists.
     */
    public synchronized boolean addAction(Action action) {
        Objects.requireNonNull(action, "action must not be null");
        if (!state.isPathResolvable()) {
            LOG.warn("Navigation path no longer exists in the current config; adding '{}' to root",
                    action.displayName());
            return store.appendChild(List.of(), action);
        }
        List<GroupRef> path = state.pathRefs();
        Optional<Node> selected = state.selectedItem();
        boolean added;
        if (selected.isPresent() && selected.get() instanceof Group group) {
            List<GroupRef> into = new ArrayList<>(path);
            into.add(GroupRef.of(group));
            added = store.appendChild(into, action);
        } else if (selected.isPresent()) {
            added = store.insertAfter(path, selected.get(), action);
        } else {
            added = store.appendChild(path, action);
        }
        if (added) {
            return true;
        }
        LOG.warn("Could not add '{}' at the current location; adding to root", action.displayName());
        return store.appendChild(List.of(), action);
    }

    /**
     * After a reload the entered groups may be gone; the menu then returns to the root.
     */
    @EventListener
    public synchronized void onConfigLoaded(ConfigLoadedEvent event) {
        if (!state.isPathResolvable()) {
            LOG.warn("Navigation path no longer exists after config load; returning to root");
            state.clear();
        }
    }

    private KeyOutcome activate(Node node, Set<Modifier> modifiers, boolean execute) {
        if (node instanceof Action action) {
            if (!execute) {
                return KeyOutcome.of(Kind.PREVIEWED, action);
            }
            if (modifierConfiguration.isSticky(modifiers)) {
                dispatch(action);
                return KeyOutcome.of(Kind.RAN_ACTION_STICKY, action);
            }
            state.clear();
            dispatch(action);
            return KeyOutcome.of(Kind.RAN_ACTION, action);
        }
        Group group = (Group) node;
        if (execute && modifierConfiguration.isGroupRun(modifiers)) {
            state.clear();
            dispatchGroup(group);
            return KeyOutcome.of(Kind.RAN_GROUP, group);
        }
        navigateToGroup(group);
        return KeyOutcome.of(Kind.DESCENDED, group);
    }

    private void dispatch(Action action) {
        try {
            dispatcher.runAction(action);
        } catch (RuntimeException e) {
            LOG.warn("Dispatch of '{}' failed: {}", action.displayName(), e.toString());
        }
    }

    private void dispatchGroup(Group group) {
        try {
            dispatcher.runGroupRecursively(group);
        } catch (RuntimeException e) {
            LOG.warn("Dispatch of group '{}' failed: {}", group.displayName(), e.toString());
        }
    }

    // ---------------------------------------------------------------- queries

    public synchronized Group currentGroup() {
        return state.currentGroup();
    }

    public synchronized List<Node> currentActions() {
        return state.currentActions();
    }

    public synchronized Optional<Node> selectedItem() {
        return state.selectedItem();
    }

    public synchronized Optional<Integer> selectedIndex() {
        return state.selectedIndex();
    }

    public synchronized void setSelectedIndex(Integer index) {
        state.setSelectedIndex(index);
    }

    public synchronized List<Group> navigationPath() {
        return state.navigationPath();
    }

    public synchronized String display() {
        return state.display();
    }

    public synchronized NavigationSnapshot snapshot() {
        List<String> path = state.navigationPath().stream().map(Group::displayName).toList();
        List<NavigationSnapshot.Item> items = state.currentActions().stream()
                .map(n -> new NavigationSnapshot.Item(n.key(), n.type().jsonName(), n.displayName(), n.isGroup()))
                .toList();
        return new NavigationSnapshot(path, state.selectedIndex().orElse(null), state.display(), items);
    }
}
