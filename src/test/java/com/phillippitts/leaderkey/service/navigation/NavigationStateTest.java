package com.phillippitts.leaderkey.service.navigation;

import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.testutil.TestTrees;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NavigationStateTest {

    private final AtomicReference<Group> root = new AtomicReference<>();
    private NavigationState state;

    @BeforeEach
    void setUp() {
        root.set(TestTrees.appsWithSubgroup());
        state = new NavigationState(root::get);
    }

    @Test
    void startsAtRootWithNothingSelected() {
        assertThat(state.currentGroup().label()).isEqualTo("Root");
        assertThat(state.currentActions()).hasSize(3);
        assertThat(state.isAtRoot()).isTrue();
        assertThat(state.selectedIndex()).isEmpty();
        assertThat(state.selectedItem()).isEmpty();
    }

    @Test
    void navigatingIntoGroupAndBackRestoresSelection() {
        state.setSelectedIndex(2);
        Group sub = (Group) state.selectedItem().orElseThrow();

        state.navigateToGroup(sub);

        assertThat(state.currentGroup().label()).isEqualTo("Subgroup");
        assertThat(state.currentActions()).extracting(Node::key).containsExactly("d", "e");
        assertThat(state.selectedIndex()).isEmpty();
        assertThat(state.selectionHistory()).containsExactly(2);

        state.setSelectedIndex(1);
        assertThat(state.selectedItem()).hasValueSatisfying(n -> assertThat(n.key()).isEqualTo("e"));

        assertThat(state.goBack()).isTrue();
        assertThat(state.isAtRoot()).isTrue();
        assertThat(state.selectedIndex()).contains(2);
        assertThat(state.selectionHistory()).isEmpty();
    }

    @Test
    void goBackAtRootDoesNothing() {
        state.setSelectedIndex(1);

        assertThat(state.goBack()).isFalse();
        assertThat(state.selectedIndex()).contains(1);
    }

    @Test
    void historyKeepsMissingSelections() {
        state.navigateToGroup((Group) root.get().children().get(2));

        assertThat(state.selectionHistory()).hasSize(1).containsNull();
    }

    @Test
    void outOfRangeSelectionYieldsNoItem() {
        state.setSelectedIndex(10);
        assertThat(state.selectedItem()).isEmpty();

        state.setSelectedIndex(-1);
        assertThat(state.selectedItem()).isEmpty();
    }

    @Test
    void moveSelectionStartsAtEitherEndThenWraps() {
        state.moveSelection(1);
        assertThat(state.selectedIndex()).contains(0);

        state.moveSelection(-1);
        assertThat(state.selectedIndex()).contains(2);

        state.moveSelection(1);
        assertThat(state.selectedIndex()).contains(0);

        state.setSelectedIndex(null);
        state.moveSelection(-1);
        assertThat(state.selectedIndex()).contains(2);
    }

    @Test
    void moveSelectionInEmptyGroupKeepsNoSelection() {
        root.set(Group.emptyRoot());

        state.moveSelection(1);

        assertThat(state.selectedIndex()).isEmpty();
    }

    @Test
    void clearResetsEverythingAndIsIdempotent() {
        state.setSelectedIndex(2);
        state.navigateToGroup((Group) root.get().children().get(2));
        state.setDisplay("c");

        state.clear();
        state.clear();

        assertThat(state.isAtRoot()).isTrue();
        assertThat(state.selectedIndex()).isEmpty();
        assertThat(state.selectionHistory()).isEmpty();
        assertThat(state.display()).isNull();
    }

    @Test
    void readsFollowReplacedTree() {
        state.navigateToGroup((Group) root.get().children().get(2));

        root.set(Group.root(List.of(Group.of("c", "Subgroup", Action.application("z", "/Applications/Z.app")))));

        assertThat(state.isPathResolvable()).isTrue();
        assertThat(state.currentActions()).extracting(Node::key).containsExactly("z");
    }

    @Test
    void unresolvablePathFallsBackToSnapshot() {
        state.navigateToGroup((Group) root.get().children().get(2));

        root.set(Group.root(List.of(Group.of("c", "Renamed"))));

        assertThat(state.isPathResolvable()).isFalse();
        assertThat(state.currentActions()).extracting(Node::key).containsExactly("d", "e");
    }

    @Test
    void noTreeMeansNoActions() {
        root.set(null);

        assertThat(state.currentGroup()).isNull();
        assertThat(state.currentActions()).isEmpty();
    }

    @Test
    void rejectsNullArguments() {
        assertThatThrownBy(() -> new NavigationState(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("rootSupplier");
        assertThatThrownBy(() -> state.navigateToGroup(null))
                .isInstanceOf(NullPointerException.class);
    }
}
