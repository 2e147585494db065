package com.zzf.pdfsandbox.session;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;

@Data
@AllArgsConstructor
public class ExpiredSession {
    private String token;
    private Duration age;
}
