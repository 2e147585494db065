package com.zzf.pdfsandbox.session;

public enum EvictionOutcome {
    EVICTED,
    /** Touched again between listing and eviction; left alone. */
    SKIPPED,
    /** Deletion failed; the entry stays for the next sweep. */
    FAILED
}
