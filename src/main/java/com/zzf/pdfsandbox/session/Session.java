package com.zzf.pdfsandbox.session;

import java.time.Instant;

/**
 * Immutable snapshot of one session's timestamps; the store replaces it on every touch.
 */
public final class Session {
    private final String token;
    private final Instant createdAt;
    private final Instant lastAccessAt;

    Session(String token, Instant createdAt, Instant lastAccessAt) {
        this.token = token;
        this.createdAt = createdAt;
        this.lastAccessAt = lastAccessAt;
    }

    static Session fresh(String token, Instant now) {
        return new Session(token, now, now);
    }

    Session touchedAt(Instant now) {
        // never move backwards if the wall clock does
        Instant next = now.isAfter(lastAccessAt) ? now : lastAccessAt;
        return new Session(token, createdAt, next);
    }

    public String getToken() {
        return token;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastAccessAt() {
        return lastAccessAt;
    }
}
