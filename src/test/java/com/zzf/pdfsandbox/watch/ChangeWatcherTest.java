package com.zzf.pdfsandbox.watch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ChangeWatcherTest {

    @TempDir
    Path root;

    private final List<Path> triggered = new CopyOnWriteArrayList<>();
    private ChangeWatcher watcher;

    @BeforeEach
    void setUp() {
        watcher = new ChangeWatcher(root, Set.of("html", "css", "json"), Duration.ofMillis(500),
                new DebounceGate(), mock(WatchStrategy.class), triggered::add);
    }

    @AfterEach
    void tearDown() {
        if (watcher.isRunning()) {
            watcher.stop();
        }
    }

    @Test
    void resolvesOwningWorkspaceForNestedFiles() {
        Path workspace = root.resolve("abc");

        assertEquals(Optional.of(workspace), ChangeWatcher.resolveWorkspace(root, workspace.resolve("index.html")));
        assertEquals(Optional.of(workspace),
                ChangeWatcher.resolveWorkspace(root, workspace.resolve("partials/deep/header.html")));
        assertEquals(Optional.empty(), ChangeWatcher.resolveWorkspace(root, root.resolve("stray.html")));
        assertEquals(Optional.empty(), ChangeWatcher.resolveWorkspace(root, root.getParent().resolve("x/y.html")));
    }

    @Test
    void ignoresUnwatchedExtensionsDirectoriesAndRootFiles() {
        assertFalse(watcher.handle(root.resolve("abc/output.pdf"), false));
        assertFalse(watcher.handle(root.resolve("abc/partials"), true));
        assertFalse(watcher.handle(root.resolve("abc/Makefile"), false));
        assertFalse(watcher.handle(root.resolve("stray.html"), false));
        assertTrue(triggered.isEmpty());
    }

    @Test
    void extensionMatchIsCaseInsensitive() {
        assertTrue(watcher.handle(root.resolve("abc/INDEX.HTML"), false));
        assertEquals(List.of(root.resolve("abc")), triggered);
    }

    @Test
    void burstOfEventsTriggersOnce() {
        Path workspace = root.resolve("abc");

        watcher.handle(workspace.resolve("index.html"), false);
        watcher.handle(workspace.resolve("styles.css"), false);
        watcher.handle(workspace.resolve("params.json"), false);

        assertEquals(List.of(workspace), triggered);
    }

    @Test
    void workspacesAreDebouncedIndependently() {
        watcher.handle(root.resolve("a/index.html"), false);
        watcher.handle(root.resolve("b/index.html"), false);

        assertEquals(List.of(root.resolve("a"), root.resolve("b")), triggered);
    }

    @Test
    void callbackFailureDoesNotEscape() {
        ChangeWatcher failing = new ChangeWatcher(root, Set.of("html"), Duration.ofMillis(500),
                new DebounceGate(), mock(WatchStrategy.class), ws -> {
                    throw new IllegalStateException("boom");
                });

        assertTrue(failing.handle(root.resolve("abc/index.html"), false));
    }

    @Test
    void startAndStopAreIdempotent() throws IOException {
        WatchStrategy strategy = mock(WatchStrategy.class);
        ChangeWatcher lifecycle = new ChangeWatcher(root, Set.of("html"), Duration.ofMillis(500),
                new DebounceGate(), strategy, triggered::add);

        lifecycle.stop();
        lifecycle.start();
        lifecycle.start();
        assertEquals(ChangeWatcher.State.RUNNING, lifecycle.getState());
        lifecycle.stop();
        lifecycle.stop();

        assertEquals(ChangeWatcher.State.STOPPED, lifecycle.getState());
        verify(strategy, times(1)).start(eq(root.toAbsolutePath().normalize()),
                any());
        verify(strategy, times(1)).stop();
    }

    @Test
    void pollingWatcherDetectsWorkspaceEdit() throws Exception {
        Path workspace = Files.createDirectories(root.resolve("abc"));
        Files.writeString(workspace.resolve("index.html"), "<p>v1</p>");
        CountDownLatch changed = new CountDownLatch(1);
        ChangeWatcher polling = new ChangeWatcher(root, Set.of("html"), Duration.ofMillis(200),
                new DebounceGate(), new PollingWatchStrategy(Duration.ofMillis(50)), ws -> {
                    triggered.add(ws);
                    changed.countDown();
                });
        polling.start();
        try {
            Thread.sleep(200);
            Files.writeString(workspace.resolve("page.html"), "<p>new</p>");

            assertTrue(changed.await(5, TimeUnit.SECONDS));
            assertEquals(workspace.toAbsolutePath().normalize(), triggered.get(0).toAbsolutePath().normalize());
        } finally {
            polling.stop();
        }
        assertFalse(polling.isRunning());
    }
}
