package com.zzf.pdfsandbox.api;

import com.zzf.pdfsandbox.model.NotFoundException;
import com.zzf.pdfsandbox.model.PathViolationException;
import com.zzf.pdfsandbox.model.StorageException;
import com.zzf.pdfsandbox.session.SessionStore;
import com.zzf.pdfsandbox.sweep.ExpirySweeper;
import com.zzf.pdfsandbox.sweep.SweepResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
public class AdminController {
    private final SessionStore sessionStore;
    private final ExpirySweeper expirySweeper;

    @GetMapping("/sessions")
    public Map<String, Object> sessions() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("active", sessionStore.activeCount());
        response.put("sweeperRunning", expirySweeper.isRunning());
        response.put("totalEvicted", expirySweeper.getTotalEvicted());
        response.put("totalEvictionFailures", expirySweeper.getTotalFailed());
        return response;
    }

    @DeleteMapping("/sessions/{token}")
    public Map<String, Object> evict(@PathVariable("token") String token) {
        if (!SessionStore.isValidToken(token)) {
            throw new PathViolationException("Invalid session token");
        }
        if (sessionStore.info(token).isEmpty()) {
            throw new NotFoundException("Session not found");
        }
        if (!sessionStore.evict(token)) {
            throw new StorageException("Failed to evict session " + SessionStore.shortId(token), null);
        }
        log.info("admin.evict session={}", SessionStore.shortId(token));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "evicted");
        response.put("active", sessionStore.activeCount());
        return response;
    }

    @PostMapping("/sweep")
    public SweepResult sweep() {
        return expirySweeper.sweepOnce();
    }
}
