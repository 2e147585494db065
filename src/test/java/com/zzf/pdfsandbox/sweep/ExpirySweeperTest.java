package com.zzf.pdfsandbox.sweep;

import com.zzf.pdfsandbox.MutableClock;
import com.zzf.pdfsandbox.session.EvictionOutcome;
import com.zzf.pdfsandbox.session.ExpiredSession;
import com.zzf.pdfsandbox.session.SessionStore;
import com.zzf.pdfsandbox.workspace.WorkspaceFactory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ExpirySweeperTest {

    private static final Duration LIFETIME = Duration.ofMinutes(30);

    @Test
    void sweepEvictsOnlyExpiredSessions(@TempDir Path tempDir) {
        MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        SessionStore store = new SessionStore(tempDir.resolve("ws"), tempDir.resolve("template"),
                new WorkspaceFactory(), LIFETIME, clock);
        Path stale = store.getOrCreateWorkspace("stale");
        clock.advance(Duration.ofMinutes(20));
        Path fresh = store.getOrCreateWorkspace("fresh");
        clock.advance(Duration.ofMinutes(11));

        ExpirySweeper sweeper = new ExpirySweeper(store, LIFETIME, Duration.ofMinutes(5));
        SweepResult result = sweeper.sweepOnce();

        assertEquals(1, result.getEvicted());
        assertEquals(0, result.getFailed());
        assertFalse(Files.exists(stale));
        assertTrue(Files.isDirectory(fresh));
        assertEquals(1, store.activeCount());
        assertEquals(1, sweeper.getTotalEvicted());
    }

    @Test
    void sweepCountsFailuresAndSkipsAndKeepsGoing() {
        SessionStore store = mock(SessionStore.class);
        when(store.listExpired(LIFETIME)).thenReturn(List.of(
                new ExpiredSession("a", LIFETIME.plusSeconds(1)),
                new ExpiredSession("b", LIFETIME.plusSeconds(1)),
                new ExpiredSession("c", LIFETIME.plusSeconds(1)),
                new ExpiredSession("d", LIFETIME.plusSeconds(1))));
        when(store.evictIfExpired("a", LIFETIME)).thenReturn(EvictionOutcome.FAILED);
        when(store.evictIfExpired("b", LIFETIME)).thenThrow(new IllegalStateException("boom"));
        when(store.evictIfExpired("c", LIFETIME)).thenReturn(EvictionOutcome.SKIPPED);
        when(store.evictIfExpired("d", LIFETIME)).thenReturn(EvictionOutcome.EVICTED);

        ExpirySweeper sweeper = new ExpirySweeper(store, LIFETIME, Duration.ofMinutes(5));
        SweepResult result = sweeper.sweepOnce();

        assertEquals(1, result.getEvicted());
        assertEquals(2, result.getFailed());
        assertEquals(1, result.getSkipped());
        assertEquals(2, sweeper.getTotalFailed());
    }

    @Test
    void emptySweepIsIdle() {
        SessionStore store = mock(SessionStore.class);
        when(store.listExpired(LIFETIME)).thenReturn(List.of());

        assertTrue(new ExpirySweeper(store, LIFETIME, Duration.ofMinutes(5)).sweepOnce().isIdle());
    }

    @Test
    void startAndStopAreIdempotent() {
        SessionStore store = mock(SessionStore.class);
        ExpirySweeper sweeper = new ExpirySweeper(store, LIFETIME, Duration.ofMillis(20));

        sweeper.stop();
        sweeper.start();
        sweeper.start();
        assertTrue(sweeper.isRunning());

        assertTimeoutPreemptively(Duration.ofSeconds(5), sweeper::stop);
        sweeper.stop();
        assertFalse(sweeper.isRunning());
    }
}
