package com.phillippitts.leaderkey.service.navigation;

import java.util.List;

/**
 * Read-only view of the menu for clients.
 *
 * @param path          display names of the groups entered, outermost first
 * @param selectedIndex selected row, or {@code null}
 * @param display       key indicator shown in the menu, or {@code null}
 * @param items         rows of the current group
 */
public record NavigationSnapshot(List<String> path, Integer selectedIndex, String display, List<Item> items) {

    public record Item(String key, String type, String name, boolean group) { }
}
