package com.zzf.pdfsandbox.config;

public enum WatchMode {
    /** OS notifications through {@link java.nio.file.WatchService}. */
    NATIVE,
    /** Fixed-interval re-scan; use where the filesystem does not propagate notifications. */
    POLLING
}
