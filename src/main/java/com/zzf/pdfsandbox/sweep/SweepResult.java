package com.zzf.pdfsandbox.sweep;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class SweepResult {
    private int evicted;
    private int failed;
    private int skipped;

    public boolean isIdle() {
        return evicted == 0 && failed == 0;
    }
}
