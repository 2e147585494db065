package com.zzf.pdfsandbox;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PdfSandboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(PdfSandboxApplication.class, args);
    }
}
