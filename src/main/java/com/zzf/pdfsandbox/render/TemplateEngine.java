package com.zzf.pdfsandbox.render;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

public interface TemplateEngine {

    /**
     * Renders a template file. {@code extends} and {@code include} resolve relative to {@code workspaceRoot}.
     */
    String render(Path mainFile, Map<String, Object> bindings, Path workspaceRoot) throws TemplateException;

    /**
     * Renders template text on its own, without extends/include support.
     */
    String renderString(String template, Map<String, Object> bindings) throws TemplateException;

    /**
     * @return the syntax error message, or empty if the template parses
     */
    Optional<String> validate(String template);
}
