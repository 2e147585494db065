package com.zzf.pdfsandbox.config;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Startup checks. Any failure here aborts the application context.
 */
@Slf4j
public final class SandboxPropertiesValidator {

    private SandboxPropertiesValidator() {
    }

    /**
     * @return the usable, absolute workspaces root
     */
    public static Path validate(SandboxProperties properties) {
        requirePositive("sandbox.session-lifetime", properties.getSessionLifetime());
        requirePositive("sandbox.cleanup-interval", properties.getCleanupInterval());
        requirePositive("sandbox.debounce-interval", properties.getDebounceInterval());
        requirePositive("sandbox.watch.poll-interval", properties.getWatch().getPollInterval());
        if (properties.getWatch().getMode() == null) {
            throw new IllegalStateException("sandbox.watch.mode must be NATIVE or POLLING");
        }
        if (properties.getWatch().normalizedExtensions().isEmpty()) {
            throw new IllegalStateException("sandbox.watch.extensions must not be empty");
        }
        if (properties.getWatch().getPollInterval().compareTo(properties.getDebounceInterval()) > 0) {
            log.warn("config.poll_interval.exceeds_debounce pollInterval={} debounce={}",
                    properties.getWatch().getPollInterval(), properties.getDebounceInterval());
        }
        requireSimpleRelative("sandbox.main-file", properties.getMainFile());
        requireSimpleRelative("sandbox.params-file", properties.getParamsFile());
        requireSimpleRelative("sandbox.artifact-name", properties.getArtifactName());

        Path root = parse("sandbox.workspaces-root", properties.getWorkspacesRoot());
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new IllegalStateException("sandbox.workspaces-root is not usable: " + root, e);
        }
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            throw new IllegalStateException("sandbox.workspaces-root is not a writable directory: " + root);
        }
        Path template = parse("sandbox.template-root", properties.getTemplateRoot());
        if (!Files.isDirectory(template)) {
            log.warn("config.template_root.missing path={} workspaces will start empty", template);
        } else if (root.startsWith(template) || template.startsWith(root)) {
            throw new IllegalStateException("sandbox.template-root and sandbox.workspaces-root must not nest");
        }
        return root;
    }

    private static void requirePositive(String key, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalStateException(key + " must be a positive duration, got " + value);
        }
    }

    private static void requireSimpleRelative(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(key + " must not be blank");
        }
        Path p;
        try {
            p = Paths.get(value.trim());
        } catch (InvalidPathException e) {
            throw new IllegalStateException(key + " is not a valid path: " + value, e);
        }
        Path normalized = p.normalize();
        if (p.isAbsolute() || value.trim().startsWith("/") || normalized.toString().isEmpty()
                || normalized.startsWith("..")) {
            throw new IllegalStateException(key + " must be a path inside the workspace, got " + value);
        }
    }

    private static Path parse(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(key + " must not be blank");
        }
        try {
            return Paths.get(value.trim()).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalStateException(key + " is not a valid path: " + value, e);
        }
    }
}
