package com.zzf.pdfsandbox.workspace;

import com.zzf.pdfsandbox.model.PathViolationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class WorkspacePathResolver {

    private WorkspacePathResolver() {
    }

    /**
     * Resolves a client-supplied relative path against the workspace root.
     * Absolute paths, paths that normalize outside the root and paths whose existing ancestors
     * are symlinks leading outside the root are rejected before any I/O on the target happens.
     */
    public static Path resolve(Path workspaceRoot, String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            throw new PathViolationException("Empty path");
        }
        String normalized = rawPath.trim().replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        Path parsed;
        try {
            parsed = Paths.get(normalized);
        } catch (InvalidPathException e) {
            throw new PathViolationException("Invalid path: " + rawPath);
        }
        if (parsed.isAbsolute() || normalized.startsWith("/")) {
            throw new PathViolationException("Absolute paths are not allowed: " + rawPath);
        }
        Path root = workspaceRoot.toAbsolutePath().normalize();
        Path resolved = root.resolve(parsed).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new PathViolationException("Path escapes workspace root: " + rawPath);
        }
        ensureRealPathInside(root, resolved, rawPath);
        return resolved;
    }

    public static String relativize(Path workspaceRoot, Path target) {
        Path root = workspaceRoot.toAbsolutePath().normalize();
        return root.relativize(target.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    private static void ensureRealPathInside(Path root, Path resolved, String rawPath) {
        Path existing = resolved;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null || !Files.exists(root)) {
            return;
        }
        try {
            Path realRoot = root.toRealPath();
            if (!existing.toRealPath().startsWith(realRoot)) {
                throw new PathViolationException("Path escapes workspace root: " + rawPath);
            }
        } catch (IOException e) {
            throw new PathViolationException("Cannot verify path: " + rawPath);
        }
    }
}
