package com.zzf.pdfsandbox.workspace;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class WorkspaceFile {
    private String path;
    private String name;
    private long size;
    private Instant modified;
}
