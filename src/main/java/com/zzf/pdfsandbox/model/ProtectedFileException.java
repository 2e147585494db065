package com.zzf.pdfsandbox.model;

public class ProtectedFileException extends SandboxException {
    public ProtectedFileException(String message) {
        super("PROTECTED_FILE", message);
    }
}
