package com.zzf.pdfsandbox.watch;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link WatchService} based observation. The JDK service is not recursive, so every directory under
 * the root is registered on start and new directories are registered as their create events arrive.
 */
@Slf4j
public final class NativeWatchStrategy implements WatchStrategy {
    private static final long POLL_TIMEOUT_MS = 250;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private WatchService watchService;
    private Thread thread;

    @Override
    public void start(Path root, FileChangeListener listener) throws IOException {
        if (running.getAndSet(true)) {
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            registerTree(root);
        } catch (IOException e) {
            running.set(false);
            closeQuietly();
            throw e;
        }
        thread = new Thread(() -> runLoop(listener), "sandbox-native-watcher");
        thread.setDaemon(true);
        thread.start();
        log.info("watch.native.start root={} dirs={}", root, keys.size());
    }

    @Override
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        closeQuietly();
        if (thread != null) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            thread = null;
        }
        keys.clear();
        log.info("watch.native.stop ok");
    }

    @Override
    public String name() {
        return "native";
    }

    private void runLoop(FileChangeListener listener) {
        while (running.get()) {
            WatchKey key;
            try {
                key = watchService.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }
            if (key == null) {
                continue;
            }
            Path dir = keys.get(key);
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW || dir == null) {
                    continue;
                }
                Path child = dir.resolve((Path) event.context());
                boolean directory = Files.isDirectory(child);
                if (directory && event.kind() == StandardWatchEventKinds.ENTRY_CREATE) {
                    try {
                        registerTree(child);
                    } catch (IOException | ClosedWatchServiceException e) {
                        log.warn("watch.native.register.fail dir={} err={}", child, e.toString());
                    }
                }
                try {
                    listener.onFileChanged(child, directory);
                } catch (RuntimeException e) {
                    log.error("watch.native.listener.fail path={}", child, e);
                }
            }
            if (!key.reset()) {
                keys.remove(key);
            }
        }
    }

    private void registerTree(Path start) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void closeQuietly() {
        if (watchService == null) {
            return;
        }
        try {
            watchService.close();
        } catch (IOException e) {
            log.warn("watch.native.close.fail err={}", e.toString());
        }
    }
}
