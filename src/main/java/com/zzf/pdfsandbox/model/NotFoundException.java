package com.zzf.pdfsandbox.model;

public class NotFoundException extends SandboxException {
    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }
}
