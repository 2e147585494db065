package com.zzf.pdfsandbox.model;

/**
 * Filesystem failure while creating, reading, writing or deleting workspace content.
 */
public class StorageException extends SandboxException {
    public StorageException(String message, Throwable cause) {
        super("STORAGE_ERROR", message, cause);
    }
}
