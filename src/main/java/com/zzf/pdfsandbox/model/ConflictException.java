package com.zzf.pdfsandbox.model;

public class ConflictException extends SandboxException {
    public ConflictException(String message) {
        super("CONFLICT", message);
    }
}
