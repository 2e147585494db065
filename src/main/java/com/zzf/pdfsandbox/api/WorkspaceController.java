package com.zzf.pdfsandbox.api;

import com.zzf.pdfsandbox.infrastructure.SessionCookieFilter;
import com.zzf.pdfsandbox.workspace.WorkspaceFile;
import com.zzf.pdfsandbox.workspace.WorkspaceFileService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import javax.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File access inside the caller's workspace. Writes are picked up by the change watcher, which
 * triggers regeneration on its own.
 */
@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class WorkspaceController {
    private final WorkspaceFileService fileService;

    @GetMapping
    public List<WorkspaceFile> list(HttpServletRequest request) {
        return fileService.list(SessionCookieFilter.workspace(request));
    }

    @GetMapping("/content")
    public ResponseEntity<String> read(@RequestParam("path") String path, HttpServletRequest request) {
        String content = fileService.readString(SessionCookieFilter.workspace(request), path);
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_PLAIN, StandardCharsets.UTF_8))
                .body(content);
    }

    @PutMapping("/content")
    public Map<String, Object> write(@RequestParam("path") String path,
                                     @RequestBody(required = false) String content,
                                     HttpServletRequest request) {
        fileService.writeString(SessionCookieFilter.workspace(request), path, content);
        return saved(path);
    }

    @PostMapping("/content")
    public ResponseEntity<Map<String, Object>> create(@RequestParam("path") String path,
                                                      @RequestBody(required = false) String content,
                                                      HttpServletRequest request) {
        fileService.create(SessionCookieFilter.workspace(request), path,
                content == null ? new byte[0] : content.getBytes(StandardCharsets.UTF_8));
        return ResponseEntity.status(201).body(saved(path));
    }

    @DeleteMapping("/content")
    public Map<String, Object> delete(@RequestParam("path") String path, HttpServletRequest request) {
        fileService.delete(SessionCookieFilter.workspace(request), path);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "deleted");
        response.put("path", path);
        return response;
    }

    private static Map<String, Object> saved(String path) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "saved");
        response.put("path", path);
        return response;
    }
}
