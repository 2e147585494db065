package com.zzf.pdfsandbox.render;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegenerationError {
    private String message;
    private String detail;
    private Instant timestamp;
}
