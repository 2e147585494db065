package com.zzf.pdfsandbox.workspace;

import com.zzf.pdfsandbox.model.ConflictException;
import com.zzf.pdfsandbox.model.NotFoundException;
import com.zzf.pdfsandbox.model.ProtectedFileException;
import com.zzf.pdfsandbox.model.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * File operations scoped to one workspace. Every path is resolved through
 * {@link WorkspacePathResolver} first, so a traversal attempt never touches the disk.
 */
@Slf4j
public class WorkspaceFileService {

    private final Set<String> protectedFiles;

    public WorkspaceFileService(Set<String> protectedFiles) {
        this.protectedFiles = protectedFiles == null ? Set.of() : Set.copyOf(protectedFiles);
    }

    public List<WorkspaceFile> list(Path workspace) {
        if (workspace == null || !Files.isDirectory(workspace)) {
            throw new NotFoundException("Workspace not found");
        }
        List<WorkspaceFile> out = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(workspace)) {
            for (Path file : walk.filter(Files::isRegularFile).collect(Collectors.toList())) {
                if (isHidden(workspace, file)) {
                    continue;
                }
                try {
                    BasicFileAttributes attrs = Files.readAttributes(file, BasicFileAttributes.class);
                    out.add(new WorkspaceFile(
                            WorkspacePathResolver.relativize(workspace, file),
                            file.getFileName().toString(),
                            attrs.size(),
                            attrs.lastModifiedTime().toInstant()));
                } catch (IOException e) {
                    // deleted between walk and stat
                    log.debug("workspace.list.skip file={} err={}", file, e.toString());
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list workspace files", e);
        }
        out.sort(Comparator.comparing(WorkspaceFile::getPath));
        return out;
    }

    public byte[] read(Path workspace, String path) {
        Path target = WorkspacePathResolver.resolve(workspace, path);
        if (!Files.isRegularFile(target)) {
            throw new NotFoundException("File not found: " + path);
        }
        try {
            return Files.readAllBytes(target);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + path, e);
        }
    }

    public String readString(Path workspace, String path) {
        return new String(read(workspace, path), StandardCharsets.UTF_8);
    }

    public void write(Path workspace, String path, byte[] content) {
        Path target = WorkspacePathResolver.resolve(workspace, path);
        if (Files.isDirectory(target)) {
            throw new ConflictException("Path is a directory: " + path);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content == null ? new byte[0] : content);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + path, e);
        }
        log.debug("workspace.file.write path={} bytes={}", path, content == null ? 0 : content.length);
    }

    public void writeString(Path workspace, String path, String content) {
        write(workspace, path, content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8));
    }

    public void create(Path workspace, String path, byte[] content) {
        Path target = WorkspacePathResolver.resolve(workspace, path);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content == null ? new byte[0] : content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw new ConflictException("File already exists: " + path);
        } catch (IOException e) {
            throw new StorageException("Failed to create " + path, e);
        }
        log.debug("workspace.file.create path={}", path);
    }

    public void delete(Path workspace, String path) {
        Path target = WorkspacePathResolver.resolve(workspace, path);
        String rel = WorkspacePathResolver.relativize(workspace, target);
        if (protectedFiles.contains(rel)) {
            throw new ProtectedFileException("Cannot delete required file: " + rel);
        }
        if (!Files.isRegularFile(target)) {
            throw new NotFoundException("File not found: " + path);
        }
        try {
            Files.delete(target);
        } catch (IOException e) {
            throw new StorageException("Failed to delete " + path, e);
        }
        log.debug("workspace.file.delete path={}", rel);
    }

    private static boolean isHidden(Path workspace, Path file) {
        Path rel = workspace.relativize(file);
        for (Path part : rel) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }
}
