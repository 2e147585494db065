package com.zzf.pdfsandbox.render;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ArtifactStatus {
    private boolean artifactExists;
    private String mainFile;
    private Instant lastGeneratedAt;
    private long lastSizeBytes;
    private RegenerationError lastError;
}
