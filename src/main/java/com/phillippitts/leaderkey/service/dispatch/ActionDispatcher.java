package com.phillippitts.leaderkey.service.dispatch;

import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.Node;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Performs the real-world effect of an action (launch, open, run).
 * Calls are fire-and-forget from the navigation engine's point of view.
 */
public interface ActionDispatcher {

    void runAction(Action action);

    /**
     * Runs every action below {@code group} depth-first in child order, descending into
     * nested groups as they are reached.
     */
    default void runGroupRecursively(Group group) {
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(group);
        while (!stack.isEmpty()) {
            Node node = stack.pop();
            if (node instanceof Group g) {
                List<Node> children = g.children();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(children.get(i));
                }
            } else if (node instanceof Action a) {
                runAction(a);
            }
        }
    }
}
