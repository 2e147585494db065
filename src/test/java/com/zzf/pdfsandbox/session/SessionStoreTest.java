package com.zzf.pdfsandbox.session;

import com.zzf.pdfsandbox.MutableClock;
import com.zzf.pdfsandbox.model.PathViolationException;
import com.zzf.pdfsandbox.model.StorageException;
import com.zzf.pdfsandbox.workspace.WorkspaceFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class SessionStoreTest {

    private static final Duration LIFETIME = Duration.ofHours(1);

    @TempDir
    Path tempDir;

    private Path templateRoot;
    private Path workspacesRoot;
    private MutableClock clock;
    private SessionStore store;

    @BeforeEach
    void setUp() throws IOException {
        templateRoot = Files.createDirectories(tempDir.resolve("template"));
        workspacesRoot = Files.createDirectories(tempDir.resolve("workspaces"));
        Files.writeString(templateRoot.resolve("index.html"), "<h1>{{ title }}</h1>", StandardCharsets.UTF_8);
        Files.createDirectories(templateRoot.resolve("assets"));
        Files.writeString(templateRoot.resolve("assets/logo.css"), "h1 {}", StandardCharsets.UTF_8);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        store = new SessionStore(workspacesRoot, templateRoot, new WorkspaceFactory(), LIFETIME, clock);
    }

    @Test
    void getOrCreateClonesTemplateOnFirstAccess() throws IOException {
        Path workspace = store.getOrCreateWorkspace("abc");

        assertEquals(workspacesRoot.resolve("abc"), workspace);
        assertEquals("<h1>{{ title }}</h1>", Files.readString(workspace.resolve("index.html")));
        assertTrue(Files.isRegularFile(workspace.resolve("assets/logo.css")));
        assertEquals(1, store.activeCount());
    }

    @Test
    void getOrCreateKeepsEditsOnLaterAccess() throws IOException {
        Path workspace = store.getOrCreateWorkspace("abc");
        Files.writeString(workspace.resolve("index.html"), "edited");

        store.getOrCreateWorkspace("abc");

        assertEquals("edited", Files.readString(workspace.resolve("index.html")));
    }

    @Test
    void concurrentFirstAccessClonesOnce() throws Exception {
        AtomicInteger copies = new AtomicInteger();
        WorkspaceFactory counting = new WorkspaceFactory() {
            @Override
            public void materialize(Path template, Path destination) throws IOException {
                copies.incrementAndGet();
                super.materialize(template, destination);
            }
        };
        SessionStore countingStore = new SessionStore(workspacesRoot, templateRoot, counting, LIFETIME, clock);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<Path>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            results.add(pool.submit(() -> {
                go.await();
                return countingStore.getOrCreateWorkspace("shared");
            }));
        }
        go.countDown();
        for (Future<Path> result : results) {
            Path workspace = result.get(10, TimeUnit.SECONDS);
            assertTrue(Files.isRegularFile(workspace.resolve("index.html")));
        }
        pool.shutdown();

        assertEquals(1, copies.get());
        assertEquals(1, countingStore.activeCount());
    }

    @Test
    void touchMovesLastAccessForward() {
        store.register("abc");
        Instant before = store.find("abc").orElseThrow().getLastAccessAt();

        clock.advance(Duration.ofSeconds(5));
        store.touch("abc");

        Instant after = store.find("abc").orElseThrow().getLastAccessAt();
        assertEquals(before.plusSeconds(5), after);
        assertEquals(before, store.find("abc").orElseThrow().getCreatedAt());
    }

    @Test
    void registerIsIdempotent() {
        store.register("abc");
        Instant created = store.find("abc").orElseThrow().getCreatedAt();
        clock.advance(Duration.ofMinutes(1));

        store.register("abc");

        assertEquals(created, store.find("abc").orElseThrow().getLastAccessAt());
        assertEquals(1, store.activeCount());
    }

    @Test
    void listExpiredUsesStrictBoundary() {
        store.register("abc");

        clock.advance(LIFETIME);
        assertTrue(store.listExpired(LIFETIME).isEmpty());

        clock.advance(Duration.ofMillis(1));
        List<ExpiredSession> expired = store.listExpired(LIFETIME);
        assertEquals(1, expired.size());
        assertEquals("abc", expired.get(0).getToken());
        assertEquals(LIFETIME.plusMillis(1), expired.get(0).getAge());
    }

    @Test
    void evictDeletesWorkspaceAndEntry() {
        Path workspace = store.getOrCreateWorkspace("abc");
        List<String> evicted = new ArrayList<>();
        store.addEvictionListener(evicted::add);

        assertTrue(store.evict("abc"));

        assertFalse(Files.exists(workspace));
        assertEquals(0, store.activeCount());
        assertEquals(List.of("abc"), evicted);
    }

    @Test
    void evictTreatsMissingWorkspaceAsEvicted() {
        store.register("ghost");

        assertTrue(store.evict("ghost"));
        assertEquals(0, store.activeCount());
    }

    @Test
    void failedDeletionKeepsEntryForRetry() throws IOException {
        WorkspaceFactory failing = spy(new WorkspaceFactory());
        SessionStore failingStore = new SessionStore(workspacesRoot, templateRoot, failing, LIFETIME, clock);
        Path workspace = failingStore.getOrCreateWorkspace("stuck");
        doThrow(new IOException("device busy")).when(failing).destroy(any(Path.class));

        assertFalse(failingStore.evict("stuck"));

        assertTrue(Files.isDirectory(workspace));
        assertEquals(1, failingStore.activeCount());
        clock.advance(LIFETIME.plusSeconds(1));
        assertEquals(1, failingStore.listExpired(LIFETIME).size());
    }

    @Test
    void evictIfExpiredSkipsSessionTouchedAfterListing() {
        store.getOrCreateWorkspace("abc");
        clock.advance(LIFETIME.plusSeconds(1));
        List<ExpiredSession> expired = store.listExpired(LIFETIME);
        assertEquals(1, expired.size());

        store.touch("abc");

        assertEquals(EvictionOutcome.SKIPPED, store.evictIfExpired("abc", LIFETIME));
        assertTrue(Files.isDirectory(store.workspacePath("abc")));
        assertEquals(1, store.activeCount());
    }

    @Test
    void evictIfExpiredRemovesStaleSession() {
        Path workspace = store.getOrCreateWorkspace("abc");
        clock.advance(LIFETIME.plusSeconds(1));

        assertEquals(EvictionOutcome.EVICTED, store.evictIfExpired("abc", LIFETIME));
        assertFalse(Files.exists(workspace));
    }

    @Test
    void accessAfterEvictionRecreatesFreshWorkspace() throws IOException {
        Path workspace = store.getOrCreateWorkspace("abc");
        Files.writeString(workspace.resolve("index.html"), "edited");
        store.evict("abc");

        Path again = store.getOrCreateWorkspace("abc");

        assertEquals("<h1>{{ title }}</h1>", Files.readString(again.resolve("index.html")));
    }

    @Test
    void evictingOneSessionLeavesOthersUntouched() throws Exception {
        Path keep = store.getOrCreateWorkspace("keep");
        store.getOrCreateWorkspace("drop");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        Future<Boolean> evicted = pool.submit(() -> store.evict("drop"));
        Future<Path> accessed = pool.submit(() -> store.getOrCreateWorkspace("keep"));
        assertTrue(evicted.get(10, TimeUnit.SECONDS));
        assertEquals(keep, accessed.get(10, TimeUnit.SECONDS));
        pool.shutdown();

        assertTrue(Files.isRegularFile(keep.resolve("index.html")));
        assertEquals(1, store.activeCount());
    }

    @Test
    void registerWaitsForEvictionInProgress() throws Exception {
        CountDownLatch deleting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        WorkspaceFactory slowDelete = new WorkspaceFactory() {
            @Override
            public boolean destroy(Path workspace) throws IOException {
                deleting.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.destroy(workspace);
            }
        };
        SessionStore slowStore = new SessionStore(workspacesRoot, templateRoot, slowDelete, LIFETIME, clock);
        slowStore.getOrCreateWorkspace("abc");

        ExecutorService pool = Executors.newFixedThreadPool(2);
        Future<Boolean> eviction = pool.submit(() -> slowStore.evict("abc"));
        assertTrue(deleting.await(10, TimeUnit.SECONDS));
        Future<?> registration = pool.submit(() -> slowStore.register("abc"));
        Thread.sleep(200);
        assertFalse(registration.isDone());

        release.countDown();
        assertTrue(eviction.get(10, TimeUnit.SECONDS));
        registration.get(10, TimeUnit.SECONDS);
        pool.shutdown();

        assertTrue(slowStore.find("abc").isPresent());
        assertEquals(1, slowStore.activeCount());
    }

    @Test
    void failedMaterializeRemovesPartialWorkspace() throws IOException {
        WorkspaceFactory broken = spy(new WorkspaceFactory());
        doThrow(new IOException("disk full")).when(broken).materialize(any(), any());
        SessionStore brokenStore = new SessionStore(workspacesRoot, templateRoot, broken, LIFETIME, clock);

        assertThrows(StorageException.class, () -> brokenStore.getOrCreateWorkspace("abc"));

        assertFalse(Files.exists(workspacesRoot.resolve("abc")));
        assertEquals(0, brokenStore.activeCount());
    }

    @Test
    void resolveIssuesTokenWhenInboundIsUnusable() {
        ResolvedSession missing = store.resolve(null);
        ResolvedSession traversal = store.resolve("../etc");
        ResolvedSession reused = store.resolve("abc");

        assertTrue(missing.isIssued());
        assertTrue(SessionStore.isValidToken(missing.getToken()));
        assertTrue(traversal.isIssued());
        assertNotEquals("../etc", traversal.getToken());
        assertFalse(reused.isIssued());
        assertEquals("abc", reused.getToken());
        assertTrue(Files.isDirectory(reused.getWorkspace()));
    }

    @Test
    void rejectsTokensThatAreNotPlainNames() {
        assertFalse(SessionStore.isValidToken(".."));
        assertFalse(SessionStore.isValidToken("a/b"));
        assertFalse(SessionStore.isValidToken(""));
        assertThrows(PathViolationException.class, () -> store.workspacePath(".."));
        assertThrows(PathViolationException.class, () -> store.getOrCreateWorkspace("a/../../b"));
    }

    @Test
    void infoReportsRemainingLifetime() {
        store.getOrCreateWorkspace("abc");
        clock.advance(Duration.ofMinutes(15));

        SessionInfo info = store.info("abc").orElseThrow();

        assertEquals("abc", info.getSessionId());
        assertEquals(45, info.getExpiresInMinutes());
        assertEquals(45 * 60, info.getExpiresInSeconds());
        assertTrue(info.isWorkspaceExists());
        assertTrue(store.info("unknown").isEmpty());
    }
}
