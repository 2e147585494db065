package com.zzf.pdfsandbox.model;

public class SandboxException extends RuntimeException {
    private final String errorCode;

    public SandboxException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public SandboxException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
