package com.phillippitts.leaderkey.domain;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeTest {

    @Test
    void displayNameUsesLabelWhenPresent() {
        Action action = Action.application("s", "/Applications/Safari.app").withLabel("Browser");
        assertThat(action.displayName()).isEqualTo("Browser");
    }

    @Test
    void displayNameDerivesFromValuePerType() {
        assertThat(Action.application("s", "/Applications/Safari.app").displayName()).isEqualTo("Safari");
        assertThat(Action.of("c", ActionType.COMMAND, "open -a Finder").displayName()).isEqualTo("open");
        assertThat(Action.of("d", ActionType.FOLDER, "/Users/me/Downloads/").displayName()).isEqualTo("Downloads");
        assertThat(Action.of("f", ActionType.FILE, "/tmp/notes.txt").displayName()).isEqualTo("notes.txt");
        assertThat(Action.of("x", ActionType.SCRIPT, "/usr/local/bin/deploy.sh").displayName()).isEqualTo("deploy");
        assertThat(Action.of("u", ActionType.URL, "https://example.com").displayName()).isEqualTo("URL");
    }

    @Test
    void groupDisplayNameFallsBackToGroup() {
        assertThat(Group.of("o", null).displayName()).isEqualTo("Group");
        assertThat(Group.of("o", "Open").displayName()).isEqualTo("Open");
    }

    @Test
    void equalityIgnoresIdentity() {
        Action first = Action.application("a", "/Applications/App1.app");
        Action second = Action.application("a", "/Applications/App1.app");

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(Group.of("g", "G", first)).isEqualTo(Group.of("g", "G", second));
    }

    @Test
    void equalityComparesSpecialKeysInGlyphForm() {
        Action text = Action.of("enter", ActionType.URL, "https://example.com");
        Action glyph = Action.of("↩", ActionType.URL, "https://example.com");

        assertThat(text).isEqualTo(glyph);
        assertThat(text.hashCode()).isEqualTo(glyph.hashCode());
    }

    @Test
    void copiesKeepId() {
        UUID id = UUID.randomUUID();
        Group group = new Group(id, "g", "G", null, List.of());

        assertThat(group.withLabel("Renamed").id()).isEqualTo(id);
        assertThat(group.withChildren(List.of(Action.application("a", "/A.app"))).id()).isEqualTo(id);
    }

    @Test
    void actionRejectsGroupType() {
        assertThatThrownBy(() -> Action.of("g", ActionType.GROUP, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void errorSentinelIsAnEmptyPlaceholderGroup() {
        Group sentinel = Group.errorSentinel();

        assertThat(sentinel.key()).isEqualTo(Group.ERROR_KEY);
        assertThat(sentinel.displayName()).isEqualTo(Group.ERROR_LABEL);
        assertThat(sentinel.children()).isEmpty();
    }

    @Test
    void blankLabelsAreStoredAsAbsent() {
        assertThat(Action.of("a", ActionType.URL, "https://x").withLabel("").label()).isNull();
        assertThat(Group.of("g", " ").label()).isNull();
        assertThat(Group.of("g", "").displayName()).isEqualTo("Group");
        assertThat(Group.of("g", "")).isEqualTo(Group.of("g", null));
        assertThat(new GroupRef("g", "").matches(Group.of("g", null))).isTrue();
    }

    @Test
    void groupRefMatchesByKeyAndLabel() {
        Group group = Group.of("enter", "Go");

        assertThat(new GroupRef("↩", "Go").matches(group)).isTrue();
        assertThat(new GroupRef("↩", "Other").matches(group)).isFalse();
        assertThat(new GroupRef(null, null).isAmbiguous()).isTrue();
    }

    @Test
    void validationErrorPathKeyJoinsIndices() {
        assertThat(new ValidationError(List.of(0, 2, 1), ValidationErrorType.EMPTY_KEY).pathKey()).isEqualTo("0/2/1");
        assertThat(ValidationError.pathKey(List.of())).isEmpty();
    }
}
