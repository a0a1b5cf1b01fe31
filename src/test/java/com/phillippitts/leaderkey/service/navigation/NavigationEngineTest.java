package com.phillippitts.leaderkey.service.navigation;

import com.phillippitts.leaderkey.config.navigation.ModifierKeyConfiguration;
import com.phillippitts.leaderkey.config.properties.ConfigStoreProperties;
import com.phillippitts.leaderkey.config.properties.NavigationProperties;
import com.phillippitts.leaderkey.domain.Action;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.service.config.CancellingConflictPrompt;
import com.phillippitts.leaderkey.service.config.ConfigCodec;
import com.phillippitts.leaderkey.service.config.ConfigStore;
import com.phillippitts.leaderkey.service.config.event.ConfigLoadedEvent;
import com.phillippitts.leaderkey.service.dispatch.ActionDispatcher;
import com.phillippitts.leaderkey.service.keys.Modifier;
import com.phillippitts.leaderkey.service.metrics.ConfigStoreMetrics;
import com.phillippitts.leaderkey.service.navigation.KeyOutcome.Kind;
import com.phillippitts.leaderkey.service.validation.DefaultConfigValidator;
import com.phillippitts.leaderkey.testutil.EventCapturingPublisher;
import com.phillippitts.leaderkey.testutil.RecordingDispatcher;
import com.phillippitts.leaderkey.testutil.SyncExecutor;
import com.phillippitts.leaderkey.testutil.TestTrees;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NavigationEngineTest {

    private static final Set<Modifier> NONE = Set.of();

    @TempDir
    Path dir;

    private final ConfigCodec codec = new ConfigCodec();
    private final RecordingDispatcher dispatcher = new RecordingDispatcher();
    private ThreadPoolTaskScheduler scheduler;
    private ConfigStore store;
    private NavigationEngine engine;

    @BeforeEach
    void setUp() throws IOException {
        Files.write(dir.resolve("config.json"), codec.encode(TestTrees.appsWithSubgroup()));
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.initialize();
        ConfigStoreProperties props = new ConfigStoreProperties(dir.toString(), dir.toString(),
                "config.json", 5000, false);
        store = new ConfigStore(props, codec, new DefaultConfigValidator(), new CancellingConflictPrompt(),
                new EventCapturingPublisher(), new SyncExecutor(), new SyncExecutor(), scheduler,
                new ConfigStoreMetrics(new SimpleMeterRegistry()));
        store.load(false).join();
        engine = newEngine(dispatcher, ModifierKeyConfiguration.CONTROL_GROUP_OPTION_STICKY);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void actionKeyRunsActionAndClosesMenu() {
        KeyOutcome outcome = engine.handleKey("a", NONE, true);

        assertThat(outcome.kind()).isEqualTo(Kind.RAN_ACTION);
        assertThat(outcome.closesMenu()).isTrue();
        assertThat(dispatcher.values()).containsExactly("/Applications/App1.app");
    }

    @Test
    void groupKeyDescendsAndShowsKey() {
        KeyOutcome outcome = engine.handleKey("c", NONE, true);

        assertThat(outcome.kind()).isEqualTo(Kind.DESCENDED);
        assertThat(outcome.closesMenu()).isFalse();
        assertThat(engine.display()).isEqualTo("c");
        assertThat(engine.currentActions()).extracting(Node::key).containsExactly("d", "e");
        assertThat(dispatcher.dispatched).isEmpty();
    }

    @Test
    void keysOnlyMatchCurrentGroup() {
        assertThat(engine.handleKey("d", NONE, true).kind()).isEqualTo(Kind.NOT_FOUND);

        engine.handleKey("c", NONE, true);

        assertThat(engine.handleKey("a", NONE, true).kind()).isEqualTo(Kind.NOT_FOUND);
        assertThat(engine.handleKey("d", NONE, true).kind()).isEqualTo(Kind.RAN_ACTION);
    }

    @Test
    void stickyModifierRunsActionAndStaysInGroup() {
        engine.handleKey("c", NONE, true);

        KeyOutcome outcome = engine.handleKey("d", Set.of(Modifier.OPTION), true);

        assertThat(outcome.kind()).isEqualTo(Kind.RAN_ACTION_STICKY);
        assertThat(outcome.closesMenu()).isFalse();
        assertThat(engine.currentGroup().label()).isEqualTo("Subgroup");
        assertThat(dispatcher.values()).containsExactly("/Applications/App3.app");
    }

    @Test
    void groupRunModifierRunsEveryActionInGroup() {
        KeyOutcome outcome = engine.handleKey("c", Set.of(Modifier.CONTROL), true);

        assertThat(outcome.kind()).isEqualTo(Kind.RAN_GROUP);
        assertThat(dispatcher.values()).containsExactly("/Applications/App3.app", "/Applications/App4.app");
        assertThat(engine.navigationPath()).isEmpty();
    }

    @Test
    void swappedModifierConfigurationSwapsRoles() {
        NavigationEngine swapped = newEngine(dispatcher, ModifierKeyConfiguration.OPTION_GROUP_CONTROL_STICKY);

        assertThat(swapped.handleKey("c", Set.of(Modifier.OPTION), true).kind()).isEqualTo(Kind.RAN_GROUP);
        assertThat(swapped.handleKey("a", Set.of(Modifier.CONTROL), true).kind()).isEqualTo(Kind.RAN_ACTION_STICKY);
    }

    @Test
    void previewNeverRunsActions() {
        assertThat(engine.handleKey("a", NONE, false).kind()).isEqualTo(Kind.PREVIEWED);
        assertThat(engine.handleKey("c", Set.of(Modifier.CONTROL), false).kind()).isEqualTo(Kind.DESCENDED);
        assertThat(dispatcher.dispatched).isEmpty();
    }

    @Test
    void questionMarkShowsCheatsheet() {
        assertThat(engine.handleKey("?", NONE, true).kind()).isEqualTo(Kind.SHOW_CHEATSHEET);
        assertThat(engine.handleKey("", NONE, true).kind()).isEqualTo(Kind.IGNORED);
    }

    @Test
    void arrowKeysMoveSelectionAndEnterActivatesIt() {
        assertThat(engine.keyDown("down", NONE).kind()).isEqualTo(Kind.SELECTION_MOVED);
        assertThat(engine.selectedIndex()).contains(0);

        engine.keyDown("↑", NONE);
        assertThat(engine.selectedIndex()).contains(2);

        KeyOutcome entered = engine.keyDown("enter", NONE);
        assertThat(entered.kind()).isEqualTo(Kind.DESCENDED);
        assertThat(engine.currentGroup().label()).isEqualTo("Subgroup");

        KeyOutcome back = engine.keyDown("left", NONE);
        assertThat(back.kind()).isEqualTo(Kind.WENT_BACK);
        assertThat(engine.selectedIndex()).contains(2);
        assertThat(engine.display()).isNull();
    }

    @Test
    void rightEntersOnlySelectedGroups() {
        engine.setSelectedIndex(0);
        assertThat(engine.keyDown("right", NONE).kind()).isEqualTo(Kind.IGNORED);

        engine.setSelectedIndex(2);
        assertThat(engine.keyDown("→", NONE).kind()).isEqualTo(Kind.DESCENDED);
    }

    @Test
    void escapeClosesAndBackspaceClears() {
        engine.handleKey("c", NONE, true);
        assertThat(engine.keyDown("backspace", NONE).kind()).isEqualTo(Kind.CLEARED);
        assertThat(engine.navigationPath()).isEmpty();

        engine.handleKey("c", NONE, true);
        KeyOutcome closed = engine.keyDown("escape", NONE);
        assertThat(closed.closesMenu()).isTrue();
        assertThat(engine.navigationPath()).isEmpty();
    }

    @Test
    void commandModifiedKeysAreIgnored() {
        assertThat(engine.keyDown("a", Set.of(Modifier.COMMAND)).kind()).isEqualTo(Kind.IGNORED);
        assertThat(dispatcher.dispatched).isEmpty();
    }

    @Test
    void goBackAtRootIsIgnored() {
        assertThat(engine.goBack().kind()).isEqualTo(Kind.IGNORED);
    }

    @Test
    void dispatchFailureDoesNotEscape() {
        ActionDispatcher failing = action -> {
            throw new IllegalStateException("boom");
        };
        NavigationEngine failingEngine = newEngine(failing, ModifierKeyConfiguration.CONTROL_GROUP_OPTION_STICKY);

        assertThat(failingEngine.handleKey("a", NONE, true).kind()).isEqualTo(Kind.RAN_ACTION);
    }

    @Test
    void addActionAppendsToCurrentGroup() {
        engine.handleKey("c", NONE, true);

        assertThat(engine.addAction(Action.application("f", "/Applications/App5.app"))).isTrue();

        assertThat(engine.currentActions()).extracting(Node::key).containsExactly("d", "e", "f");
    }

    @Test
    void addActionInsertsAfterSelectedAction() {
        engine.setSelectedIndex(0);

        engine.addAction(Action.application("x", "/Applications/X.app"));

        assertThat(store.root().children()).extracting(Node::key).containsExactly("a", "x", "b", "c");
    }

    @Test
    void addActionGoesIntoSelectedGroup() {
        engine.setSelectedIndex(2);

        engine.addAction(Action.application("f", "/Applications/App5.app"));

        Group sub = (Group) store.root().children().get(2);
        assertThat(sub.children()).extracting(Node::key).containsExactly("d", "e", "f");
    }

    @Test
    void addActionFallsBackToRootWhenGroupIsGone() {
        engine.handleKey("c", NONE, true);
        store.replaceSubtree(List.of(), Group.root(List.of(Action.application("a", "/Applications/App1.app"))));

        assertThat(engine.addAction(Action.application("f", "/Applications/App5.app"))).isTrue();

        assertThat(store.root().children()).extracting(Node::key).containsExactly("a", "f");
    }

    @Test
    void deleteRemovesSelectedItemAndClampsSelection() {
        engine.setSelectedIndex(2);

        assertThat(engine.deleteSelectedItem()).isTrue();

        assertThat(store.root().children()).extracting(Node::key).containsExactly("a", "b");
        assertThat(engine.selectedIndex()).contains(1);
    }

    @Test
    void deleteWithoutSelectionDoesNothing() {
        assertThat(engine.deleteSelectedItem()).isFalse();
        assertThat(store.root().children()).hasSize(3);
    }

    @Test
    void deleteAbortsWhenGroupIsGone() {
        engine.handleKey("c", NONE, true);
        engine.setSelectedIndex(0);
        store.replaceSubtree(List.of(), Group.root(List.of(Action.application("a", "/Applications/App1.app"))));

        assertThat(engine.deleteSelectedItem()).isFalse();
        assertThat(store.root().children()).hasSize(1);
    }

    @Test
    void configLoadReturnsToRootWhenPathIsGone() {
        engine.handleKey("c", NONE, true);
        Group replaced = Group.root(List.of(Action.application("a", "/Applications/App1.app")));
        store.replaceSubtree(List.of(), replaced);

        engine.onConfigLoaded(new ConfigLoadedEvent(store.configFile(), replaced, 0, Instant.now()));

        assertThat(engine.navigationPath()).isEmpty();
        assertThat(engine.currentActions()).hasSize(1);
    }

    @Test
    void configLoadKeepsPathThatStillResolves() {
        engine.handleKey("c", NONE, true);

        engine.onConfigLoaded(new ConfigLoadedEvent(store.configFile(), store.root(), 0, Instant.now()));

        assertThat(engine.navigationPath()).hasSize(1);
    }

    @Test
    void snapshotDescribesCurrentGroup() {
        engine.handleKey("c", NONE, true);
        engine.moveSelection(1);

        NavigationSnapshot snapshot = engine.snapshot();

        assertThat(snapshot.path()).containsExactly("Subgroup");
        assertThat(snapshot.selectedIndex()).isZero();
        assertThat(snapshot.display()).isEqualTo("c");
        assertThat(snapshot.items()).extracting(NavigationSnapshot.Item::name).containsExactly("App3", "App4");
        assertThat(snapshot.items()).extracting(NavigationSnapshot.Item::type).containsOnly("application");
    }

    private NavigationEngine newEngine(ActionDispatcher d, ModifierKeyConfiguration config) {
        return new NavigationEngine(store, d, new NavigationProperties(config));
    }
}
