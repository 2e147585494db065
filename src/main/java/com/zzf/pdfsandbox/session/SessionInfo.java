package com.zzf.pdfsandbox.session;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class SessionInfo {
    private String sessionId;
    private Instant createdAt;
    private Instant lastAccessAt;
    private long expiresInSeconds;
    private long expiresInMinutes;
    private boolean workspaceExists;
}
