package com.zzf.pdfsandbox.model;

/**
 * A requested path resolves outside the workspace it was requested against.
 */
public class PathViolationException extends SandboxException {
    public PathViolationException(String message) {
        super("PATH_VIOLATION", message);
    }
}
