package com.zzf.pdfsandbox.bus;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class ArtifactUpdatedEvent {
    private String workspace;
    private Instant timestamp;
    private long size;
}
