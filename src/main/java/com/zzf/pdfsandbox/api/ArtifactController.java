package com.zzf.pdfsandbox.api;

import com.zzf.pdfsandbox.bus.ArtifactEventBus;
import com.zzf.pdfsandbox.bus.ArtifactFailedEvent;
import com.zzf.pdfsandbox.bus.ArtifactUpdatedEvent;
import com.zzf.pdfsandbox.infrastructure.SessionCookieFilter;
import com.zzf.pdfsandbox.model.NotFoundException;
import com.zzf.pdfsandbox.render.ArtifactStatus;
import com.zzf.pdfsandbox.render.RegenerationDispatcher;
import com.zzf.pdfsandbox.render.RegenerationOutcome;
import com.zzf.pdfsandbox.render.TemplateException;
import com.zzf.pdfsandbox.session.SessionInfo;
import com.zzf.pdfsandbox.session.SessionStore;
import com.zzf.pdfsandbox.workspace.WorkspacePathResolver;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.CacheControl;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import javax.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ArtifactController {
    private static final long SSE_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final MediaType CSS = new MediaType("text", "css", StandardCharsets.UTF_8);

    private final RegenerationDispatcher dispatcher;
    private final ArtifactEventBus eventBus;
    private final SessionStore sessionStore;

    @Data
    public static class MainFileRequest {
        private String path;
    }

    /**
     * Synchronous regeneration; subscribers of the event stream are notified as well.
     */
    @PostMapping("/regenerate")
    public Map<String, Object> regenerate(HttpServletRequest request) {
        Path workspace = SessionCookieFilter.workspace(request);
        RegenerationOutcome outcome = dispatcher.regenerate(workspace, true);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("outcome", outcome);
        response.put("status", dispatcher.status(workspace));
        return response;
    }

    @GetMapping("/status")
    public ArtifactStatus status(HttpServletRequest request) {
        return dispatcher.status(SessionCookieFilter.workspace(request));
    }

    @GetMapping("/pdf")
    public ResponseEntity<Resource> pdf(HttpServletRequest request) {
        Path artifact = dispatcher.artifactPath(SessionCookieFilter.workspace(request));
        if (!Files.isRegularFile(artifact)) {
            throw new NotFoundException("No PDF generated yet");
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_PDF)
                .cacheControl(CacheControl.noStore())
                .body(new FileSystemResource(artifact));
    }

    /**
     * Rendered HTML with a base element pointing at {@link #previewStylesheet}, so relative
     * stylesheet links resolve against the caller's workspace.
     */
    @GetMapping("/preview")
    public ResponseEntity<String> preview(HttpServletRequest request) throws TemplateException {
        String markup = dispatcher.preview(SessionCookieFilter.workspace(request));
        return ResponseEntity.ok()
                .contentType(new MediaType(MediaType.TEXT_HTML, StandardCharsets.UTF_8))
                .body(withBase(markup, request.getContextPath() + "/api/preview/"));
    }

    /**
     * Only stylesheets are served; everything else in the workspace stays behind the file API.
     */
    @GetMapping("/preview/{*path}")
    public ResponseEntity<Resource> previewStylesheet(@PathVariable("path") String path, HttpServletRequest request) {
        String rel = path.startsWith("/") ? path.substring(1) : path;
        if (!rel.toLowerCase(Locale.ROOT).endsWith(".css")) {
            throw new NotFoundException("Not a stylesheet: " + rel);
        }
        Path file = WorkspacePathResolver.resolve(SessionCookieFilter.workspace(request), rel);
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException("Stylesheet not found: " + rel);
        }
        return ResponseEntity.ok()
                .contentType(CSS)
                .cacheControl(CacheControl.noStore())
                .body(new FileSystemResource(file));
    }

    @PutMapping("/main-file")
    public ArtifactStatus setMainFile(@RequestBody MainFileRequest body, HttpServletRequest request) {
        Path workspace = SessionCookieFilter.workspace(request);
        dispatcher.setMainFile(workspace, body == null ? null : body.getPath());
        dispatcher.regenerate(workspace, true);
        return dispatcher.status(workspace);
    }

    @GetMapping("/session")
    public SessionInfo session(HttpServletRequest request) {
        return sessionStore.info(SessionCookieFilter.token(request))
                .orElseThrow(() -> new NotFoundException("Session not found"));
    }

    /**
     * Streams artifact events for the caller's workspace only.
     */
    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(HttpServletRequest request) {
        String token = SessionCookieFilter.token(request);
        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);
        AtomicReference<Runnable> unsubscribe = new AtomicReference<>();
        unsubscribe.set(eventBus.subscribeAll(event -> {
            if (!token.equals(workspaceOf(event.getProperties()))) {
                return;
            }
            try {
                emitter.send(SseEmitter.event().name(event.getType()).data(event.getProperties()));
            } catch (IOException | IllegalStateException e) {
                log.debug("sse.send.fail session={} err={}", SessionStore.shortId(token), e.toString());
                Runnable handle = unsubscribe.get();
                if (handle != null) {
                    handle.run();
                }
                emitter.completeWithError(e);
            }
        }));
        emitter.onCompletion(() -> unsubscribe.get().run());
        emitter.onTimeout(() -> {
            unsubscribe.get().run();
            emitter.complete();
        });
        emitter.onError(e -> unsubscribe.get().run());
        log.debug("sse.open session={}", SessionStore.shortId(token));
        return emitter;
    }

    static String withBase(String markup, String href) {
        Document doc = Jsoup.parse(markup);
        doc.outputSettings().prettyPrint(false);
        if (doc.head().selectFirst("base") == null) {
            doc.head().prependElement("base").attr("href", href);
        }
        return doc.outerHtml();
    }

    static String workspaceOf(Object properties) {
        if (properties instanceof ArtifactUpdatedEvent) {
            return ((ArtifactUpdatedEvent) properties).getWorkspace();
        }
        if (properties instanceof ArtifactFailedEvent) {
            return ((ArtifactFailedEvent) properties).getWorkspace();
        }
        return null;
    }
}
