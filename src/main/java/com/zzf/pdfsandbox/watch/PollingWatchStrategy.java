package com.zzf.pdfsandbox.watch;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.monitor.FileAlterationListenerAdaptor;
import org.apache.commons.io.monitor.FileAlterationMonitor;
import org.apache.commons.io.monitor.FileAlterationObserver;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Fixed-interval re-scan through commons-io. Needed on container and VM mounts that never deliver
 * native notifications.
 */
@Slf4j
public final class PollingWatchStrategy implements WatchStrategy {
    private final Duration pollInterval;
    private FileAlterationMonitor monitor;

    public PollingWatchStrategy(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    @Override
    public synchronized void start(Path root, FileChangeListener listener) throws IOException {
        if (monitor != null) {
            return;
        }
        FileAlterationObserver observer = new FileAlterationObserver(root.toFile());
        observer.addListener(new FileAlterationListenerAdaptor() {
            @Override
            public void onFileCreate(File file) {
                dispatch(listener, file, false);
            }

            @Override
            public void onFileChange(File file) {
                dispatch(listener, file, false);
            }

            @Override
            public void onDirectoryCreate(File directory) {
                dispatch(listener, directory, true);
            }
        });
        FileAlterationMonitor created = new FileAlterationMonitor(pollInterval.toMillis(), observer);
        created.setThreadFactory(r -> {
            Thread t = new Thread(r, "sandbox-polling-watcher");
            t.setDaemon(true);
            return t;
        });
        try {
            created.start();
        } catch (Exception e) {
            throw new IOException("Failed to start polling monitor for " + root, e);
        }
        monitor = created;
        log.info("watch.polling.start root={} intervalMs={}", root, pollInterval.toMillis());
    }

    @Override
    public synchronized void stop() {
        if (monitor == null) {
            return;
        }
        try {
            // joins the monitor thread for up to one interval past its current sleep
            monitor.stop(pollInterval.toMillis() * 2 + 100);
        } catch (Exception e) {
            log.warn("watch.polling.stop.fail err={}", e.toString());
        } finally {
            monitor = null;
        }
        log.info("watch.polling.stop ok");
    }

    @Override
    public String name() {
        return "polling";
    }

    private static void dispatch(FileChangeListener listener, File file, boolean directory) {
        try {
            listener.onFileChanged(file.toPath(), directory);
        } catch (RuntimeException e) {
            log.error("watch.polling.listener.fail path={}", file, e);
        }
    }
}
