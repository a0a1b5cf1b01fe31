package com.phillippitts.leaderkey.service.config;

import com.phillippitts.leaderkey.config.properties.ConfigStoreProperties;
import com.phillippitts.leaderkey.domain.ActionType;
import com.phillippitts.leaderkey.domain.Group;
import com.phillippitts.leaderkey.domain.GroupRef;
import com.phillippitts.leaderkey.domain.Node;
import com.phillippitts.leaderkey.domain.ValidationError;
import com.phillippitts.leaderkey.domain.ValidationErrorType;
import com.phillippitts.leaderkey.exception.ConfigReadException;
import com.phillippitts.leaderkey.exception.ConfigWriteException;
import com.phillippitts.leaderkey.service.config.event.ConfigConflictEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigDirectoryResetEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigLoadFailedEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigLoadedEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigReloadedEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigReloadingEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigSavedEvent;
import com.phillippitts.leaderkey.service.config.event.ConfigWriteFailedEvent;
import com.phillippitts.leaderkey.service.metrics.ConfigStoreMetrics;
import com.phillippitts.leaderkey.service.validation.ConfigValidator;
import com.phillippitts.leaderkey.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.io.ClassPathResource;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Owns the canonical configuration tree and keeps it in sync with one JSON file.
 *
 * <p><b>Loading:</b> the file is read, decoded and validated on the config I/O executor; the
 * result is applied on the main executor. A later load supersedes an earlier one that has not
 * been applied yet. A file that cannot be decoded leaves the tree as the error placeholder
 * ({@link Group#errorSentinel()}) and puts the store in error state: edits are rejected and
 * the broken file is never overwritten by a save until a load succeeds.
 *
 * <p><b>Saving:</b> every edit goes through {@link #edit(UnaryOperator)}, which revalidates and
 * schedules a debounced save. When the timer fires the tree current at that moment is encoded
 * once and written atomically (temp file plus move). Before any write the SHA-256 of the file on
 * disk is compared with the checksum recorded at the last read or write; a mismatch means the
 * file was edited externally and the {@link ConflictPrompt} decides between overwrite, cancel
 * and reload. While the prompt is open no other save runs.
 *
 * <p><b>Thread Safety:</b> the root reference and validation state are swapped under one lock
 * and published through volatile fields, so readers always see a consistent snapshot.
 */
@Service
public class ConfigStore implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(ConfigStore.class);

    static final String DEFAULT_CONFIG_RESOURCE = "default-config.json";

    private final ConfigStoreProperties props;
    private final ConfigCodec codec;
    private final ConfigValidator validator;
    private final ConflictPrompt conflictPrompt;
    private final ApplicationEventPublisher publisher;
    private final Executor ioExecutor;
    private final Executor mainExecutor;
    private final TaskScheduler scheduler;
    private final ConfigStoreMetrics metrics;

    private final Object stateLock = new Object();
    private volatile Group root = Group.errorSentinel();
    private volatile boolean errorState = true;
    private volatile List<ValidationError> validationErrors = List.of();
    private volatile Map<String, ValidationErrorType> validationErrorsByPath = Map.of();
    private volatile String lastReadChecksum;
    private volatile boolean loading;
    private volatile Path directory;
    private final AtomicLong loadGeneration = new AtomicLong();

    private final Object saveLock = new Object();
    private ScheduledFuture<?> pendingSave; // guarded by saveLock
    private long saveSequence; // guarded by saveLock
    private final ReentrantLock writeLock = new ReentrantLock();
    private final AtomicBoolean promptOpen = new AtomicBoolean();

    private volatile boolean running;

    public ConfigStore(ConfigStoreProperties props,
                       ConfigCodec codec,
                       ConfigValidator validator,
                       ConflictPrompt conflictPrompt,
                       ApplicationEventPublisher publisher,
                       @Qualifier("configIoExecutor") Executor ioExecutor,
                       @Qualifier("mainExecutor") Executor mainExecutor,
                       @Qualifier("configSaveScheduler") TaskScheduler scheduler,
                       ConfigStoreMetrics metrics) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.conflictPrompt = Objects.requireNonNull(conflictPrompt, "conflictPrompt must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor must not be null");
        this.mainExecutor = Objects.requireNonNull(mainExecutor, "mainExecutor must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.directory = props.directoryPath();
    }

    // ---------------------------------------------------------------- lifecycle

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        if (props.isLoadOnStartup()) {
            ensureAndLoad();
        } else {
            LOG.info("Config load on startup disabled; tree stays empty until reload");
        }
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (cancelPendingSave()) {
            LOG.info("Writing pending config changes before shutdown");
            flush();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // ---------------------------------------------------------------- loading

    /**
     * Makes sure the config directory and file exist, then loads the file.
     *
     * <p>A missing directory is replaced by the default directory with a warning. A missing
     * file is created from the bundled default document.
     *
     * @return completes on the main executor with the root that was installed
     */
    public CompletableFuture<Group> ensureAndLoad() {
        try {
            ensureValidDirectory();
            ensureConfigFileExists();
        } catch (ConfigWriteException e) {
            reportWriteFailure(e);
            return CompletableFuture.completedFuture(root);
        }
        return load(false);
    }

    /**
     * Reads and decodes the config file off the main executor and installs the result on it.
     *
     * @param discardPendingSave drop a scheduled save first, so in-memory edits that were
     *                           not flushed yet cannot overwrite the file just read
     * @return completes with the installed root (the error placeholder on failure)
     */
    public CompletableFuture<Group> load(boolean discardPendingSave) {
        long generation = loadGeneration.incrementAndGet();
        loading = true;
        if (discardPendingSave && cancelPendingSave()) {
            LOG.debug("Discarded pending save before load");
        }
        Path file = configFile();
        return CompletableFuture.supplyAsync(() -> readConfig(file), ioExecutor)
                .handleAsync((loaded, error) -> applyLoad(generation, file, loaded, error), mainExecutor);
    }

    /**
     * Discards in-memory changes and loads the file from disk, announcing the reload with
     * {@link ConfigReloadingEvent} and {@link ConfigReloadedEvent}.
     */
    public CompletableFuture<Group> reloadFromFile() {
        Path file = configFile();
        LOG.info("Reloading config from {}", LogSanitizer.displayPath(file));
        publisher.publishEvent(new ConfigReloadingEvent(file, Instant.now()));
        return load(true).whenComplete((installed, error) ->
                publisher.publishEvent(new ConfigReloadedEvent(file,
                        error == null && !errorState, Instant.now())));
    }

    private record LoadedConfig(Group root, String checksum, List<ValidationError> errors) { }

    private LoadedConfig readConfig(Path file) {
        if (!Files.exists(file)) {
            return null;
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ConfigReadException(file, e);
        }
        Group decoded = codec.decode(bytes);
        return new LoadedConfig(decoded, ConfigChecksum.of(bytes), validator.validate(decoded));
    }

    private Group applyLoad(long generation, Path file, LoadedConfig loaded, Throwable error) {
        if (generation != loadGeneration.get()) {
            LOG.debug("Discarding superseded config load #{}", generation);
            return root;
        }
        try {
            if (error != null) {
                Throwable cause = unwrap(error);
                String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
                LOG.error("Failed to load config from {}: {}", LogSanitizer.displayPath(file), reason);
                installErrorState();
                metrics.recordLoad(false);
                publisher.publishEvent(new ConfigLoadFailedEvent(file, reason, Instant.now()));
                return root;
            }
            if (loaded == null) {
                LOG.info("No config file at {}", LogSanitizer.displayPath(file));
                installErrorState();
                lastReadChecksum = null;
                return root;
            }
            synchronized (stateLock) {
                installRoot(loaded.root(), loaded.errors());
                errorState = false;
            }
            lastReadChecksum = loaded.checksum();
            metrics.recordLoad(true);
            LOG.info("Loaded config from {} ({} validation errors)", LogSanitizer.displayPath(file), loaded.errors().size());
            publisher.publishEvent(new ConfigLoadedEvent(file, loaded.root(), loaded.errors().size(), Instant.now()));
            return loaded.root();
        } finally {
            loading = false;
        }
    }

    private void ensureValidDirectory() {
        Path configured = directory;
        if (Files.isDirectory(configured)) {
            return;
        }
        Path fallback = props.defaultDirectoryPath();
        if (!configured.equals(fallback)) {
            LOG.warn("Config directory does not exist: {}. Resetting to default location {}", configured, fallback);
            publisher.publishEvent(new ConfigDirectoryResetEvent(configured, fallback, Instant.now()));
        }
        try {
            Files.createDirectories(fallback);
        } catch (IOException e) {
            throw new ConfigWriteException("Failed to create config directory: " + fallback, fallback, e);
        }
        directory = fallback;
    }

    private void ensureConfigFileExists() {
        Path file = configFile();
        if (Files.exists(file)) {
            return;
        }
        LOG.info("Creating default config at {}", LogSanitizer.displayPath(file));
        writeAtomically(file, defaultDocument());
    }

    static byte[] defaultDocument() {
        try {
            return new ClassPathResource(DEFAULT_CONFIG_RESOURCE).getContentAsByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Bundled " + DEFAULT_CONFIG_RESOURCE + " is missing", e);
        }
    }

    // ---------------------------------------------------------------- editing

    /**
     * Applies a structural change to the canonical tree, revalidates it and schedules a
     * debounced save. While a load is in progress the change is applied but not saved.
     *
     * @return {@code false} when nothing changed or the tree is the error placeholder
     */
    public boolean edit(UnaryOperator<Group> change) {
        Objects.requireNonNull(change, "change must not be null");
        return applyEdit(current -> Optional.ofNullable(change.apply(current)));
    }

    /** Appends {@code child} to the group at {@code path}. */
    public boolean appendChild(List<GroupRef> path, Node child) {
        return applyEdit(current -> ConfigTreeEditor.appendChild(current, path, child));
    }

    /** Inserts {@code node} after {@code sibling} in the group at {@code path}. */
    public boolean insertAfter(List<GroupRef> path, Node sibling, Node node) {
        return applyEdit(current -> ConfigTreeEditor.insertAfter(current, path, sibling, node));
    }

    /** Removes {@code target} from the group at {@code path}. */
    public boolean delete(List<GroupRef> path, Node target) {
        return applyEdit(current -> ConfigTreeEditor.remove(current, path, target));
    }

    /** Replaces the group at {@code path}; an empty path replaces the whole tree. */
    public boolean replaceSubtree(List<GroupRef> path, Group replacement) {
        return applyEdit(current -> ConfigTreeEditor.replaceSubtree(current, path, replacement));
    }

    private boolean applyEdit(Function<Group, Optional<Group>> change) {
        synchronized (stateLock) {
            Group current = root;
            if (errorState) {
                LOG.warn("Config is in error state; fix the file and reload before editing");
                return false;
            }
            Optional<Group> updated = change.apply(current);
            if (updated.isEmpty()) {
                LOG.debug("Edit target no longer resolves; tree unchanged");
                return false;
            }
            if (updated.get().equals(current)) {
                return false;
            }
            installRoot(updated.get(), validator.validate(updated.get()));
        }
        if (loading) {
            LOG.debug("Edit while loading; save not scheduled");
        } else {
            saveDebounced();
        }
        return true;
    }

    // ---------------------------------------------------------------- saving

    /**
     * Writes the current tree now, on the calling thread, after the conflict check.
     */
    public SaveResult save() {
        return save(false);
    }

    /**
     * Writes the current tree now, replacing any external changes without prompting.
     */
    public SaveResult saveOverwriting() {
        return save(true);
    }

    private SaveResult save(boolean overwrite) {
        cancelPendingSave();
        Group snapshot = root;
        if (loading || errorState) {
            LOG.info("Save skipped: {}", loading ? "load in progress" : "config is in error state");
            metrics.recordSave(SaveResult.SKIPPED);
            return SaveResult.SKIPPED;
        }
        revalidate();
        if (!writeLock.tryLock()) {
            LOG.info("Another save is in progress; scheduling a debounced save");
            saveDebounced();
            return SaveResult.SKIPPED;
        }
        SaveResult result;
        try {
            result = writeWithConflictCheck(snapshot, overwrite, false);
        } finally {
            writeLock.unlock();
        }
        metrics.recordSave(result);
        return result;
    }

    /**
     * Schedules a save after the debounce window. A save already pending is cancelled, so a
     * burst of edits produces one write holding the latest tree.
     */
    public void saveDebounced() {
        synchronized (saveLock) {
            if (pendingSave != null) {
                pendingSave.cancel(false);
            }
            long sequence = ++saveSequence;
            pendingSave = scheduler.schedule(() -> flushPendingSave(sequence),
                    Instant.now().plusMillis(props.getDebounceMs()));
        }
    }

    public boolean hasPendingSave() {
        synchronized (saveLock) {
            return pendingSave != null;
        }
    }

    private boolean cancelPendingSave() {
        synchronized (saveLock) {
            saveSequence++;
            if (pendingSave == null) {
                return false;
            }
            boolean cancelled = pendingSave.cancel(false);
            pendingSave = null;
            return cancelled;
        }
    }

    private void flushPendingSave(long sequence) {
        synchronized (saveLock) {
            if (sequence != saveSequence) {
                return;
            }
            pendingSave = null;
        }
        if (promptOpen.get()) {
            LOG.debug("Conflict prompt open; save deferred until it is answered");
            return;
        }
        ioExecutor.execute(this::flush);
    }

    void flush() {
        Group snapshot = root;
        if (loading || errorState) {
            LOG.debug("Skipping debounced save (loading={}, errorState={})", loading, errorState);
            metrics.recordSave(SaveResult.SKIPPED);
            return;
        }
        SaveResult result;
        writeLock.lock();
        try {
            result = writeWithConflictCheck(snapshot, false, true);
        } finally {
            writeLock.unlock();
        }
        metrics.recordSave(result);
    }

    private SaveResult writeWithConflictCheck(Group snapshot, boolean overwrite, boolean promptOnMain) {
        Path file = configFile();
        byte[] bytes = codec.encode(snapshot);
        String expected = lastReadChecksum;

        if (!overwrite && expected != null && Files.exists(file)) {
            String current;
            try {
                current = ConfigChecksum.of(Files.readAllBytes(file));
            } catch (IOException e) {
                reportWriteFailure(new ConfigWriteException("Failed to check config file before write: " + file,
                        file, e));
                return SaveResult.FAILED;
            }
            if (!expected.equals(current)) {
                ConflictResolution resolution = promptOnMain ? askOnMain(file) : ask(file);
                LOG.warn("Config file {} changed on disk since last read; resolution={}",
                        LogSanitizer.displayPath(file), resolution);
                metrics.recordConflict(resolution);
                publisher.publishEvent(new ConfigConflictEvent(file, resolution, Instant.now()));
                if (resolution == ConflictResolution.RELOAD) {
                    reloadFromFile();
                    return SaveResult.RELOADED;
                }
                if (!root.equals(snapshot)) {
                    LOG.debug("Tree changed while the conflict prompt was open; scheduling another save");
                    saveDebounced();
                }
                if (resolution == ConflictResolution.CANCEL) {
                    return SaveResult.CANCELLED;
                }
            }
        }

        try {
            writeAtomically(file, bytes);
        } catch (ConfigWriteException e) {
            reportWriteFailure(e);
            return SaveResult.FAILED;
        }
        String checksum = ConfigChecksum.of(bytes);
        lastReadChecksum = checksum;
        LOG.debug("Saved config to {} ({} bytes)", LogSanitizer.displayPath(file), bytes.length);
        publisher.publishEvent(new ConfigSavedEvent(file, checksum, Instant.now()));
        return SaveResult.WRITTEN;
    }

    private ConflictResolution ask(Path file) {
        promptOpen.set(true);
        try {
            return conflictPrompt.askOverwriteCancelReload(file);
        } finally {
            promptOpen.set(false);
        }
    }

    private ConflictResolution askOnMain(Path file) {
        promptOpen.set(true);
        try {
            return CompletableFuture.supplyAsync(() -> conflictPrompt.askOverwriteCancelReload(file), mainExecutor)
                    .join();
        } catch (CompletionException | RejectedExecutionException e) {
            LOG.error("Conflict prompt failed; cancelling this save", unwrap(e));
            return ConflictResolution.CANCEL;
        } finally {
            promptOpen.set(false);
        }
    }

    private static void writeAtomically(Path file, byte[] bytes) {
        Path tmp = null;
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, "." + file.getFileName() + "-", ".tmp");
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                LOG.debug("Atomic move not supported for {}; falling back to replace", file);
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteTempFile(tmp);
            throw new ConfigWriteException(file, e);
        }
    }

    private static void deleteTempFile(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.debug("Could not remove temp file {}: {}", tmp, e.toString());
        }
    }

    private void reportWriteFailure(ConfigWriteException e) {
        LOG.error("Config write failed: {}", e.getMessage(), e);
        publisher.publishEvent(new ConfigWriteFailedEvent(e.getPath(),
                e.getCause() == null ? e.getMessage() : e.getCause().toString(), Instant.now()));
    }

    // ---------------------------------------------------------------- validation

    /** Recomputes validation state for the current tree without saving. */
    public List<ValidationError> revalidate() {
        synchronized (stateLock) {
            Group current = root;
            installRoot(current, errorState ? List.of() : validator.validate(current));
            return validationErrors;
        }
    }

    public List<ValidationError> validationErrors() {
        return validationErrors;
    }

    /** Errors keyed by {@link ValidationError#pathKey()}; the first error of a node wins. */
    public Map<String, ValidationErrorType> validationErrorsByPath() {
        return validationErrorsByPath;
    }

    public Optional<ValidationErrorType> validationError(List<Integer> path) {
        return Optional.ofNullable(validationErrorsByPath.get(ValidationError.pathKey(path)));
    }

    private void installErrorState() {
        synchronized (stateLock) {
            installRoot(Group.errorSentinel(), List.of());
            errorState = true;
        }
    }

    private void installRoot(Group newRoot, List<ValidationError> errors) {
        synchronized (stateLock) {
            Map<String, ValidationErrorType> byPath = new LinkedHashMap<>();
            for (ValidationError e : errors) {
                byPath.putIfAbsent(e.pathKey(), e.type());
            }
            root = newRoot;
            validationErrors = List.copyOf(errors);
            validationErrorsByPath = Collections.unmodifiableMap(byPath);
        }
    }

    // ---------------------------------------------------------------- queries

    public Group root() {
        return root;
    }

    /**
     * {@code true} until a load succeeds, and again after a load fails; the tree is then the
     * error placeholder.
     */
    public boolean isInErrorState() {
        return errorState;
    }

    public boolean isLoading() {
        return loading;
    }

    public Path directory() {
        return directory;
    }

    public Path configFile() {
        return directory.resolve(props.getFileName());
    }

    public Optional<String> lastReadChecksum() {
        return Optional.ofNullable(lastReadChecksum);
    }

    /** Values of all actions of the given kinds anywhere in the tree. */
    public Set<String> actionValues(Set<ActionType> types) {
        return ConfigTreeEditor.actionValues(root, types);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
