package com.zzf.pdfsandbox.render;

import com.mitchellbosecke.pebble.PebbleEngine;
import com.mitchellbosecke.pebble.error.LoaderException;
import com.mitchellbosecke.pebble.error.ParserException;
import com.mitchellbosecke.pebble.error.PebbleException;
import com.mitchellbosecke.pebble.loader.FileLoader;
import com.mitchellbosecke.pebble.loader.Loader;
import com.mitchellbosecke.pebble.loader.StringLoader;
import com.mitchellbosecke.pebble.template.PebbleTemplate;
import com.zzf.pdfsandbox.model.PathViolationException;
import com.zzf.pdfsandbox.workspace.WorkspacePathResolver;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Jinja-style templates through Pebble. Output is not auto-escaped, matching Jinja defaults for
 * templates that produce markup.
 */
@Slf4j
public class PebbleTemplateEngine implements TemplateEngine {
    private static final Pattern INHERITANCE_TAG = Pattern.compile("\\{%-?\\s*(extends|include|import)\\b");

    private final boolean injectNow;
    private final Clock clock;
    private final PebbleEngine stringEngine;

    public PebbleTemplateEngine() {
        this(true, Clock.systemDefaultZone());
    }

    public PebbleTemplateEngine(boolean injectNow, Clock clock) {
        this.injectNow = injectNow;
        this.clock = clock;
        this.stringEngine = buildEngine(new StringLoader());
    }

    @Override
    public String render(Path mainFile, Map<String, Object> bindings, Path workspaceRoot) throws TemplateException {
        if (mainFile == null || !Files.isRegularFile(mainFile)) {
            throw new TemplateException("Template file not found: " + mainFile);
        }
        Map<String, Object> context = prepareContext(bindings);
        String templateName = WorkspacePathResolver.relativize(workspaceRoot, mainFile);
        try {
            FileLoader loader = new WorkspaceFileLoader(workspaceRoot);
            loader.setPrefix(workspaceRoot.toAbsolutePath().normalize().toString());
            loader.setCharset(StandardCharsets.UTF_8.name());
            return evaluate(buildEngine(loader), templateName, context);
        } catch (ParserException e) {
            log.warn("template.parse.fail template={} err={}", templateName, e.getMessage());
            throw new TemplateException(e.getMessage(), e);
        } catch (LoaderException e) {
            return renderFallback(mainFile, templateName, bindings, e);
        } catch (PebbleException e) {
            log.warn("template.render.fail template={} err={}", templateName, e.getMessage());
            throw new TemplateException(e.getMessage(), e);
        }
    }

    @Override
    public String renderString(String template, Map<String, Object> bindings) throws TemplateException {
        try {
            return evaluate(stringEngine, template == null ? "" : template, prepareContext(bindings));
        } catch (PebbleException e) {
            throw new TemplateException(e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> validate(String template) {
        try {
            stringEngine.getTemplate(template == null ? "" : template);
            return Optional.empty();
        } catch (PebbleException e) {
            return Optional.of(e.getMessage());
        }
    }

    /**
     * String-only rendering for a main file the loader could not serve. Templates that depend on
     * extends/include cannot be rendered this way, so the loader error stands for them.
     */
    private String renderFallback(Path mainFile, String templateName, Map<String, Object> bindings,
                                  LoaderException cause) throws TemplateException {
        String source;
        try {
            source = Files.readString(mainFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateException("Failed to read template " + templateName + ": " + e.getMessage(), e);
        }
        if (INHERITANCE_TAG.matcher(source).find()) {
            log.warn("template.resolve.fail template={} err={}", templateName, cause.getMessage());
            throw new TemplateException(cause.getMessage(), cause);
        }
        log.warn("template.file.fallback template={} err={}", templateName, cause.getMessage());
        try {
            return renderString(source, bindings);
        } catch (TemplateException fallback) {
            throw new TemplateException("Template rendering failed with both methods: " + fallback.getMessage(), fallback);
        }
    }

    private Map<String, Object> prepareContext(Map<String, Object> bindings) {
        Map<String, Object> context = bindings == null ? new HashMap<>() : new HashMap<>(bindings);
        if (injectNow && !context.containsKey("now")) {
            context.put("now", LocalDateTime.now(clock));
        }
        return context;
    }

    private static String evaluate(PebbleEngine engine, String name, Map<String, Object> context) {
        PebbleTemplate template = engine.getTemplate(name);
        StringWriter writer = new StringWriter();
        try {
            template.evaluate(writer, context);
        } catch (IOException e) {
            // StringWriter does not throw
            throw new IllegalStateException(e);
        }
        return writer.toString();
    }

    /**
     * File loader that refuses any template name resolving outside the workspace, including names
     * with a leading slash or a {@code ..} segment after a subdirectory.
     */
    static final class WorkspaceFileLoader extends FileLoader {
        private final Path workspaceRoot;

        WorkspaceFileLoader(Path workspaceRoot) {
            this.workspaceRoot = workspaceRoot;
        }

        @Override
        public Reader getReader(String templateName) {
            try {
                WorkspacePathResolver.resolve(workspaceRoot, templateName);
            } catch (PathViolationException e) {
                log.warn("template.resolve.denied template={}", templateName);
                throw new LoaderException(e, "Template outside workspace: " + templateName);
            }
            return super.getReader(templateName);
        }
    }

    private static PebbleEngine buildEngine(Loader<?> loader) {
        return new PebbleEngine.Builder()
                .loader(loader)
                .autoEscaping(false)
                .cacheActive(false)
                .strictVariables(false)
                .newLineTrimming(false)
                .build();
    }
}
