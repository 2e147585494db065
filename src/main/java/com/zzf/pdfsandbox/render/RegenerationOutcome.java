package com.zzf.pdfsandbox.render;

public enum RegenerationOutcome {
    SKIPPED_NO_MAIN,
    /** Main file is blank: nothing to render yet, not an error. */
    SKIPPED_EMPTY,
    SUCCEEDED,
    FAILED
}
