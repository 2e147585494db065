package com.zzf.pdfsandbox.watch;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Observes the workspaces root, maps each change to its owning workspace and forwards at most one
 * event per debounce window per workspace to the regeneration callback.
 * <p>
 * A workspace is always an immediate child of the root; events for files directly under the root are
 * dropped.
 */
@Slf4j
public class ChangeWatcher {

    public enum State {
        STOPPED,
        RUNNING
    }

    private final Path root;
    private final Set<String> extensions;
    private final Duration debounceInterval;
    private final DebounceGate debounceGate;
    private final WatchStrategy strategy;
    private final Consumer<Path> onWorkspaceChanged;

    private State state = State.STOPPED;

    public ChangeWatcher(Path root, Set<String> extensions, Duration debounceInterval, DebounceGate debounceGate,
                         WatchStrategy strategy, Consumer<Path> onWorkspaceChanged) {
        this.root = root.toAbsolutePath().normalize();
        this.extensions = Set.copyOf(extensions);
        this.debounceInterval = debounceInterval;
        this.debounceGate = debounceGate;
        this.strategy = strategy;
        this.onWorkspaceChanged = onWorkspaceChanged;
        log.info("watch.init root={} mode={} debounce={} extensions={}",
                this.root, strategy.name(), debounceInterval, this.extensions);
    }

    public synchronized void start() {
        if (state == State.RUNNING) {
            log.warn("watch.start skip reason=already_running");
            return;
        }
        try {
            Files.createDirectories(root);
            strategy.start(root, this::handle);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to start watching " + root, e);
        }
        state = State.RUNNING;
        log.info("watch.start ok root={} mode={}", root, strategy.name());
    }

    /**
     * Blocks until the observation loop has terminated.
     */
    public synchronized void stop() {
        if (state == State.STOPPED) {
            log.warn("watch.stop skip reason=not_running");
            return;
        }
        strategy.stop();
        state = State.STOPPED;
        log.info("watch.stop ok");
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized boolean isRunning() {
        return state == State.RUNNING;
    }

    /**
     * Entry point for raw events from the strategy.
     *
     * @return true if the event was admitted and the callback ran
     */
    boolean handle(Path path, boolean directory) {
        if (directory || path == null) {
            return false;
        }
        if (!isWatchedExtension(path)) {
            return false;
        }
        Optional<Path> workspace = resolveWorkspace(root, path);
        if (workspace.isEmpty()) {
            return false;
        }
        String workspaceId = workspace.get().getFileName().toString();
        if (!debounceGate.admit(workspaceId, debounceInterval)) {
            log.debug("watch.debounce.skip workspace={} file={}", workspaceId, path.getFileName());
            return false;
        }
        log.info("watch.change workspace={} file={}", workspaceId, path.getFileName());
        try {
            onWorkspaceChanged.accept(workspace.get());
        } catch (RuntimeException e) {
            log.error("watch.callback.fail workspace={}", workspaceId, e);
        }
        return true;
    }

    /**
     * Walks up from the file to the ancestor that sits directly below the root.
     */
    static Optional<Path> resolveWorkspace(Path root, Path file) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path current = file.toAbsolutePath().normalize().getParent();
        if (current == null || !current.startsWith(normalizedRoot) || current.equals(normalizedRoot)) {
            return Optional.empty();
        }
        while (current.getParent() != null && !current.getParent().equals(normalizedRoot)) {
            current = current.getParent();
        }
        return normalizedRoot.equals(current.getParent()) ? Optional.of(current) : Optional.empty();
    }

    private boolean isWatchedExtension(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }
}
