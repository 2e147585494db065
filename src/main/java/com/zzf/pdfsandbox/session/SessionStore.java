package com.zzf.pdfsandbox.session;

import com.zzf.pdfsandbox.model.PathViolationException;
import com.zzf.pdfsandbox.model.StorageException;
import com.zzf.pdfsandbox.workspace.WorkspaceFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Registry of live sessions and the single source of truth for workspace existence.
 * <p>
 * Workspace creation and eviction for a token run under that token's lock only, so a slow clone or
 * delete never stalls unrelated sessions.
 */
@Slf4j
public class SessionStore {
    private static final Pattern TOKEN_PATTERN = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final Path workspacesRoot;
    private final Path templateRoot;
    private final WorkspaceFactory workspaceFactory;
    private final Duration sessionLifetime;
    private final Clock clock;

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final List<Consumer<String>> evictionListeners = new CopyOnWriteArrayList<>();

    public SessionStore(Path workspacesRoot, Path templateRoot, WorkspaceFactory workspaceFactory,
                        Duration sessionLifetime, Clock clock) {
        this.workspacesRoot = workspacesRoot.toAbsolutePath().normalize();
        this.templateRoot = templateRoot == null ? null : templateRoot.toAbsolutePath().normalize();
        this.workspaceFactory = workspaceFactory;
        this.sessionLifetime = sessionLifetime;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        log.info("session.store.init workspacesRoot={} templateRoot={} lifetime={}",
                this.workspacesRoot, this.templateRoot, sessionLifetime);
    }

    public String createSessionId() {
        return UUID.randomUUID().toString();
    }

    public static boolean isValidToken(String token) {
        return token != null
                && TOKEN_PATTERN.matcher(token).matches()
                && !".".equals(token)
                && !"..".equals(token);
    }

    public void register(String token) {
        requireValid(token);
        ReentrantLock lock = lockFor(token);
        try {
            if (!sessions.containsKey(token)) {
                sessions.put(token, Session.fresh(token, clock.instant()));
                log.info("session.register session={}", shortId(token));
            }
        } finally {
            lock.unlock();
        }
    }

    public void touch(String token) {
        requireValid(token);
        ReentrantLock lock = lockFor(token);
        try {
            touchLocked(token);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the workspace for the token, cloning the template on first access. Concurrent callers
     * for the same token wait for the one performing the clone and then see the finished tree.
     *
     * @throws StorageException if the workspace cannot be materialized; the partial tree is removed
     */
    public Path getOrCreateWorkspace(String token) {
        requireValid(token);
        Path workspace = workspacePath(token);
        ReentrantLock lock = lockFor(token);
        try {
            touchLocked(token);
            if (Files.isDirectory(workspace)) {
                return workspace;
            }
            log.info("workspace.create.start session={}", shortId(token));
            try {
                workspaceFactory.materialize(templateRoot, workspace);
            } catch (IOException e) {
                log.error("workspace.create.fail session={} err={}", shortId(token), e.toString());
                discardPartial(token, workspace);
                sessions.remove(token);
                throw new StorageException("Failed to create workspace", e);
            }
            log.info("workspace.create.ok session={}", shortId(token));
            return workspace;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Session resolution for the transport layer: reuses the inbound token when it is usable,
     * otherwise issues a new one.
     */
    public ResolvedSession resolve(String inboundToken) {
        boolean issued = !isValidToken(inboundToken);
        String token = issued ? createSessionId() : inboundToken;
        return new ResolvedSession(token, getOrCreateWorkspace(token), issued);
    }

    public Path workspacePath(String token) {
        requireValid(token);
        Path workspace = workspacesRoot.resolve(token).normalize();
        if (!workspace.getParent().equals(workspacesRoot)) {
            throw new PathViolationException("Invalid session token");
        }
        return workspace;
    }

    public Path getWorkspacesRoot() {
        return workspacesRoot;
    }

    public List<ExpiredSession> listExpired(Duration lifetime) {
        Instant now = clock.instant();
        List<ExpiredSession> expired = new ArrayList<>();
        for (Session session : sessions.values()) {
            Duration age = Duration.between(session.getLastAccessAt(), now);
            if (age.compareTo(lifetime) > 0) {
                expired.add(new ExpiredSession(session.getToken(), age));
            }
        }
        return expired;
    }

    /**
     * Deletes the workspace and drops the session. A workspace that is already gone counts as evicted.
     * On any other deletion failure the entry is kept so the next sweep retries.
     */
    public boolean evict(String token) {
        return evictInternal(token, null) == EvictionOutcome.EVICTED;
    }

    /**
     * Like {@link #evict(String)}, but re-checks expiry under the token lock so a session touched after
     * {@link #listExpired(Duration)} survives.
     */
    public EvictionOutcome evictIfExpired(String token, Duration lifetime) {
        return evictInternal(token, lifetime);
    }

    private EvictionOutcome evictInternal(String token, Duration lifetime) {
        if (!isValidToken(token)) {
            return EvictionOutcome.FAILED;
        }
        Path workspace = workspacePath(token);
        ReentrantLock lock = lockFor(token);
        boolean evicted = false;
        try {
            Session session = sessions.get(token);
            if (lifetime != null && session != null
                    && Duration.between(session.getLastAccessAt(), clock.instant()).compareTo(lifetime) <= 0) {
                log.debug("session.evict.skip session={} reason=touched", shortId(token));
                return EvictionOutcome.SKIPPED;
            }
            try {
                if (!workspaceFactory.destroy(workspace)) {
                    log.info("session.evict.absent session={}", shortId(token));
                }
            } catch (IOException e) {
                if (Files.exists(workspace)) {
                    log.error("session.evict.fail session={} err={}", shortId(token), e.toString());
                    return EvictionOutcome.FAILED;
                }
            }
            sessions.remove(token);
            locks.remove(token, lock);
            evicted = true;
            log.info("session.evict.ok session={}", shortId(token));
            return EvictionOutcome.EVICTED;
        } finally {
            lock.unlock();
            if (evicted) {
                notifyEvicted(token);
            }
        }
    }

    public void addEvictionListener(Consumer<String> listener) {
        evictionListeners.add(listener);
    }

    public int activeCount() {
        return sessions.size();
    }

    public Optional<SessionInfo> info(String token) {
        Session session = token == null ? null : sessions.get(token);
        if (session == null) {
            return Optional.empty();
        }
        Duration age = Duration.between(session.getLastAccessAt(), clock.instant());
        Duration expiresIn = sessionLifetime.minus(age);
        return Optional.of(SessionInfo.builder()
                .sessionId(token)
                .createdAt(session.getCreatedAt())
                .lastAccessAt(session.getLastAccessAt())
                .expiresInSeconds(expiresIn.getSeconds())
                .expiresInMinutes(expiresIn.toMinutes())
                .workspaceExists(Files.isDirectory(workspacePath(token)))
                .build());
    }

    Optional<Session> find(String token) {
        return Optional.ofNullable(token == null ? null : sessions.get(token));
    }

    public static String shortId(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }

    private void touchLocked(String token) {
        Instant now = clock.instant();
        Session previous = sessions.get(token);
        if (previous == null) {
            sessions.put(token, Session.fresh(token, now));
            log.info("session.register session={}", shortId(token));
        } else {
            sessions.put(token, previous.touchedAt(now));
        }
    }

    /**
     * Locks the token, retrying when the lock was retired by an eviction while this thread waited.
     */
    private ReentrantLock lockFor(String token) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(token, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(token) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    private void discardPartial(String token, Path workspace) {
        try {
            workspaceFactory.destroy(workspace);
        } catch (IOException cleanup) {
            log.warn("workspace.create.cleanup.fail session={} err={}", shortId(token), cleanup.toString());
        }
    }

    private void notifyEvicted(String token) {
        for (Consumer<String> listener : evictionListeners) {
            try {
                listener.accept(token);
            } catch (RuntimeException e) {
                log.warn("session.evict.listener.fail session={} err={}", shortId(token), e.toString());
            }
        }
    }

    private static void requireValid(String token) {
        if (!isValidToken(token)) {
            throw new PathViolationException("Invalid session token");
        }
    }
}
