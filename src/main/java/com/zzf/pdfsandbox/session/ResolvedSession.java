package com.zzf.pdfsandbox.session;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.nio.file.Path;

@Data
@AllArgsConstructor
public class ResolvedSession {
    private String token;
    private Path workspace;
    /** True when the inbound token was absent or unusable and a new one was issued. */
    private boolean issued;
}
