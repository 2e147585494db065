package com.zzf.pdfsandbox.render;

public class RenderException extends Exception {
    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
