package com.zzf.pdfsandbox.render;

import com.zzf.pdfsandbox.bus.ArtifactEventBus;
import com.zzf.pdfsandbox.bus.ArtifactFailedEvent;
import com.zzf.pdfsandbox.bus.ArtifactUpdatedEvent;
import com.zzf.pdfsandbox.model.NotFoundException;
import com.zzf.pdfsandbox.workspace.WorkspacePathResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns a workspace's main template into its PDF artifact and reports the result.
 * <p>
 * Regenerations of one workspace are serialized on a per-workspace lock so two triggers never write the
 * artifact at the same time; different workspaces never contend. Nothing thrown by the collaborators
 * escapes {@link #regenerate(Path, boolean)}.
 */
@Slf4j
public class RegenerationDispatcher {
    private final TemplateEngine templateEngine;
    private final DocumentRenderer documentRenderer;
    private final ParametersLoader parametersLoader;
    private final ArtifactEventBus eventBus;
    private final String defaultMainFile;
    private final String paramsFile;
    private final String artifactName;
    private final Clock clock;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<String, ArtifactRecord> records = new ConcurrentHashMap<>();
    private final Map<String, String> mainFileOverrides = new ConcurrentHashMap<>();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    public RegenerationDispatcher(TemplateEngine templateEngine, DocumentRenderer documentRenderer,
                                  ParametersLoader parametersLoader, ArtifactEventBus eventBus,
                                  String defaultMainFile, String paramsFile, String artifactName, Clock clock) {
        this.templateEngine = templateEngine;
        this.documentRenderer = documentRenderer;
        this.parametersLoader = parametersLoader;
        this.eventBus = eventBus;
        this.defaultMainFile = defaultMainFile;
        this.paramsFile = paramsFile;
        this.artifactName = artifactName;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public RegenerationOutcome regenerate(Path workspace, boolean notify) {
        String workspaceId = workspaceId(workspace);
        ReentrantLock lock = lockFor(workspaceId);
        try {
            return regenerateLocked(workspace, workspaceId, notify);
        } catch (RuntimeException e) {
            // collaborator bugs are reported like any other failure
            recordFailure(workspaceId, e, notify);
            return RegenerationOutcome.FAILED;
        } finally {
            lock.unlock();
        }
    }

    private RegenerationOutcome regenerateLocked(Path workspace, String workspaceId, boolean notify) {
        Path mainFile = mainFilePath(workspace);
        if (!Files.isRegularFile(mainFile)) {
            log.info("regen.skip workspace={} reason=no_main file={}", shortId(workspaceId), mainFile.getFileName());
            return RegenerationOutcome.SKIPPED_NO_MAIN;
        }
        String source;
        try {
            source = Files.readString(mainFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            recordFailure(workspaceId, e, notify);
            return RegenerationOutcome.FAILED;
        }
        if (source.isBlank()) {
            log.debug("regen.skip workspace={} reason=empty_main", shortId(workspaceId));
            return RegenerationOutcome.SKIPPED_EMPTY;
        }

        long start = System.nanoTime();
        Path output = artifactPath(workspace);
        Path staging = workspace.resolve("." + artifactName + ".tmp");
        try {
            Map<String, Object> params = parametersLoader.load(workspace.resolve(paramsFile));
            String markup = templateEngine.render(mainFile, params, workspace);
            documentRenderer.render(markup, staging, workspace.toUri().toString());
            replace(staging, output);
        } catch (TemplateException | RenderException | IOException e) {
            deleteQuietly(staging);
            recordFailure(workspaceId, e, notify);
            return RegenerationOutcome.FAILED;
        } catch (RuntimeException e) {
            deleteQuietly(staging);
            throw e;
        }

        long size = sizeOf(output);
        Instant now = clock.instant();
        records.put(workspaceId, new ArtifactRecord(now, size, null));
        succeeded.incrementAndGet();
        log.info("regen.ok workspace={} sizeKb={} tookMs={}", shortId(workspaceId),
                String.format("%.1f", size / 1024.0), (System.nanoTime() - start) / 1_000_000);
        if (notify) {
            eventBus.publish(ArtifactEventBus.ARTIFACT_UPDATED, new ArtifactUpdatedEvent(workspaceId, now, size));
        }
        return RegenerationOutcome.SUCCEEDED;
    }

    /**
     * Rendered markup for the main file, without producing a document.
     *
     * @throws NotFoundException if the workspace has no main file
     */
    public String preview(Path workspace) throws TemplateException {
        Path mainFile = mainFilePath(workspace);
        if (!Files.isRegularFile(mainFile)) {
            throw new NotFoundException("Main file not found: " + mainFileName(workspace));
        }
        Map<String, Object> params = parametersLoader.load(workspace.resolve(paramsFile));
        return templateEngine.render(mainFile, params, workspace);
    }

    public ArtifactStatus status(Path workspace) {
        ArtifactRecord record = records.get(workspaceId(workspace));
        return ArtifactStatus.builder()
                .artifactExists(Files.isRegularFile(artifactPath(workspace)))
                .mainFile(mainFileName(workspace))
                .lastGeneratedAt(record == null ? null : record.generatedAt)
                .lastSizeBytes(record == null ? 0L : record.sizeBytes)
                .lastError(record == null ? null : record.error)
                .build();
    }

    /**
     * Points the workspace at a different main markup file.
     */
    public void setMainFile(Path workspace, String relativePath) {
        Path target = WorkspacePathResolver.resolve(workspace, relativePath);
        if (!Files.isRegularFile(target)) {
            throw new NotFoundException("File not found: " + relativePath);
        }
        String rel = WorkspacePathResolver.relativize(workspace, target);
        if (rel.equals(defaultMainFile)) {
            mainFileOverrides.remove(workspaceId(workspace));
        } else {
            mainFileOverrides.put(workspaceId(workspace), rel);
        }
        log.info("regen.main.set workspace={} mainFile={}", shortId(workspaceId(workspace)), rel);
    }

    public String mainFileName(Path workspace) {
        return mainFileOverrides.getOrDefault(workspaceId(workspace), defaultMainFile);
    }

    public Path artifactPath(Path workspace) {
        return workspace.resolve(artifactName);
    }

    /**
     * Drops everything held for an evicted workspace. Waits for a regeneration in flight, and keeps
     * the lock while another regeneration of the same id is queued on it.
     */
    public void forget(String workspaceId) {
        ReentrantLock lock = lockFor(workspaceId);
        try {
            records.remove(workspaceId);
            mainFileOverrides.remove(workspaceId);
        } finally {
            lock.unlock();
        }
        locks.computeIfPresent(workspaceId, (k, l) -> l.isLocked() || l.hasQueuedThreads() ? l : null);
    }

    public long getSucceededCount() {
        return succeeded.get();
    }

    public long getFailedCount() {
        return failed.get();
    }

    /**
     * Locks the workspace, retrying when {@link #forget(String)} retired the lock while this thread waited.
     */
    private ReentrantLock lockFor(String workspaceId) {
        while (true) {
            ReentrantLock lock = locks.computeIfAbsent(workspaceId, k -> new ReentrantLock());
            lock.lock();
            if (locks.get(workspaceId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    int trackedLocks() {
        return locks.size();
    }

    private Path mainFilePath(Path workspace) {
        return workspace.resolve(mainFileName(workspace)).normalize();
    }

    private void recordFailure(String workspaceId, Exception e, boolean notify) {
        Instant now = clock.instant();
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        RegenerationError error = new RegenerationError(message, stackTrace(e), now);
        ArtifactRecord previous = records.get(workspaceId);
        records.put(workspaceId, previous == null
                ? new ArtifactRecord(null, 0L, error)
                : new ArtifactRecord(previous.generatedAt, previous.sizeBytes, error));
        failed.incrementAndGet();
        log.warn("regen.fail workspace={} err={}", shortId(workspaceId), message);
        if (notify) {
            eventBus.publish(ArtifactEventBus.ARTIFACT_FAILED, new ArtifactFailedEvent(workspaceId, error, now));
        }
    }

    private static void replace(Path staging, Path output) throws IOException {
        try {
            Files.move(staging, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(staging, output, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("regen.staging.cleanup.fail file={} err={}", file, e.toString());
        }
    }

    private static String stackTrace(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    private static String workspaceId(Path workspace) {
        return workspace.getFileName().toString();
    }

    private static String shortId(String id) {
        return id.length() <= 8 ? id : id.substring(0, 8) + "...";
    }

    private static final class ArtifactRecord {
        private final Instant generatedAt;
        private final long sizeBytes;
        private final RegenerationError error;

        private ArtifactRecord(Instant generatedAt, long sizeBytes, RegenerationError error) {
            this.generatedAt = generatedAt;
            this.sizeBytes = sizeBytes;
            this.error = error;
        }
    }
}
