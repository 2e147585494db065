package com.zzf.pdfsandbox.bus;

import com.zzf.pdfsandbox.render.RegenerationError;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class ArtifactFailedEvent {
    private String workspace;
    private RegenerationError error;
    private Instant timestamp;
}
