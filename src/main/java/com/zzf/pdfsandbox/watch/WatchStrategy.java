package com.zzf.pdfsandbox.watch;

import java.io.IOException;
import java.nio.file.Path;

/**
 * How raw create/modify events under a root are observed. Implementations report every event,
 * filtering is left to {@link ChangeWatcher}.
 */
public interface WatchStrategy {

    void start(Path root, FileChangeListener listener) throws IOException;

    /**
     * Stops observation and returns only after the observation thread has terminated.
     */
    void stop();

    String name();
}
