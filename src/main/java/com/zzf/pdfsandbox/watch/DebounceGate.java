package com.zzf.pdfsandbox.watch;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Leading-edge debouncer keyed by workspace id.
 * <p>
 * The first event after a quiet period is admitted at once. Later events inside the window are
 * rejected without moving the window, which stays anchored to the last admitted event.
 */
public final class DebounceGate {
    private final Map<String, Long> lastAdmittedNanos = new ConcurrentHashMap<>();
    private final LongSupplier nanoClock;

    public DebounceGate() {
        this(System::nanoTime);
    }

    public DebounceGate(LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
    }

    public boolean admit(String key, Duration interval) {
        if (key == null) {
            return false;
        }
        long intervalNanos = interval == null ? 0L : interval.toNanos();
        long now = nanoClock.getAsLong();
        boolean[] admitted = {false};
        lastAdmittedNanos.compute(key, (k, previous) -> {
            if (previous == null || now - previous >= intervalNanos) {
                admitted[0] = true;
                return now;
            }
            return previous;
        });
        return admitted[0];
    }

    public void forget(String key) {
        if (key != null) {
            lastAdmittedNanos.remove(key);
        }
    }

    int trackedKeys() {
        return lastAdmittedNanos.size();
    }
}
