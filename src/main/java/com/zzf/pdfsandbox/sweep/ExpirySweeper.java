package com.zzf.pdfsandbox.sweep;

import com.zzf.pdfsandbox.session.EvictionOutcome;
import com.zzf.pdfsandbox.session.ExpiredSession;
import com.zzf.pdfsandbox.session.SessionStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Background loop that evicts sessions unused for longer than the session lifetime.
 * <p>
 * Each eviction holds only the lock of the session being evicted; requests for other sessions proceed.
 */
@Slf4j
public class ExpirySweeper {
    private final SessionStore sessionStore;
    private final Duration sessionLifetime;
    private final Duration cleanupInterval;

    private final AtomicLong totalEvicted = new AtomicLong();
    private final AtomicLong totalFailed = new AtomicLong();
    private ScheduledExecutorService scheduler;

    public ExpirySweeper(SessionStore sessionStore, Duration sessionLifetime, Duration cleanupInterval) {
        this.sessionStore = sessionStore;
        this.sessionLifetime = sessionLifetime;
        this.cleanupInterval = cleanupInterval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            log.warn("sweeper.start skip reason=already_running");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sandbox-expiry-sweeper");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = cleanupInterval.toMillis();
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("sweeper.start ok interval={} lifetime={}", cleanupInterval, sessionLifetime);
    }

    public synchronized void stop() {
        if (scheduler == null) {
            log.warn("sweeper.stop skip reason=not_running");
            return;
        }
        // lets a sweep in progress finish; pending wakes are cancelled
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("sweeper.stop timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("sweeper.stop ok");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public SweepResult sweepOnce() {
        List<ExpiredSession> expired = sessionStore.listExpired(sessionLifetime);
        int evicted = 0;
        int failed = 0;
        int skipped = 0;
        for (ExpiredSession session : expired) {
            EvictionOutcome outcome;
            try {
                outcome = sessionStore.evictIfExpired(session.getToken(), sessionLifetime);
            } catch (RuntimeException e) {
                log.error("sweeper.evict.error session={}", SessionStore.shortId(session.getToken()), e);
                outcome = EvictionOutcome.FAILED;
            }
            switch (outcome) {
                case EVICTED:
                    evicted++;
                    log.info("sweeper.evict.ok session={} ageMin={}",
                            SessionStore.shortId(session.getToken()), session.getAge().toMinutes());
                    break;
                case SKIPPED:
                    skipped++;
                    break;
                default:
                    failed++;
                    break;
            }
        }
        totalEvicted.addAndGet(evicted);
        totalFailed.addAndGet(failed);
        SweepResult result = new SweepResult(evicted, failed, skipped);
        if (!result.isIdle()) {
            log.info("sweeper.done evicted={} failed={} skipped={} active={}",
                    evicted, failed, skipped, sessionStore.activeCount());
        }
        return result;
    }

    public long getTotalEvicted() {
        return totalEvicted.get();
    }

    public long getTotalFailed() {
        return totalFailed.get();
    }

    private void sweepSafely() {
        try {
            sweepOnce();
        } catch (RuntimeException e) {
            // a throwing task would cancel the schedule
            log.error("sweeper.run.fail", e);
        }
    }
}
