package com.zzf.pdfsandbox.render;

/**
 * Template syntax error, unresolved extends/include, or evaluation failure.
 */
public class TemplateException extends Exception {
    public TemplateException(String message) {
        super(message);
    }

    public TemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
