package com.zzf.pdfsandbox.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "sandbox")
public class SandboxProperties {
    private String workspacesRoot = "./workspaces";
    private String templateRoot = "./playground_files";
    private Duration sessionLifetime = Duration.ofHours(1);
    private Duration cleanupInterval = Duration.ofMinutes(5);
    private Duration debounceInterval = Duration.ofMillis(500);
    private String mainFile = "index.html";
    private String paramsFile = "params.json";
    private String artifactName = "output.pdf";
    private int regenerationThreads = 4;
    private final Watch watch = new Watch();

    public String getWorkspacesRoot() {
        return workspacesRoot;
    }

    public void setWorkspacesRoot(String workspacesRoot) {
        this.workspacesRoot = workspacesRoot;
    }

    public String getTemplateRoot() {
        return templateRoot;
    }

    public void setTemplateRoot(String templateRoot) {
        this.templateRoot = templateRoot;
    }

    public Duration getSessionLifetime() {
        return sessionLifetime;
    }

    public void setSessionLifetime(Duration sessionLifetime) {
        this.sessionLifetime = sessionLifetime;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    public Duration getDebounceInterval() {
        return debounceInterval;
    }

    public void setDebounceInterval(Duration debounceInterval) {
        this.debounceInterval = debounceInterval;
    }

    public String getMainFile() {
        return mainFile;
    }

    public void setMainFile(String mainFile) {
        this.mainFile = mainFile;
    }

    public String getParamsFile() {
        return paramsFile;
    }

    public void setParamsFile(String paramsFile) {
        this.paramsFile = paramsFile;
    }

    public String getArtifactName() {
        return artifactName;
    }

    public void setArtifactName(String artifactName) {
        this.artifactName = artifactName;
    }

    public int getRegenerationThreads() {
        return regenerationThreads;
    }

    public void setRegenerationThreads(int regenerationThreads) {
        this.regenerationThreads = regenerationThreads;
    }

    public Watch getWatch() {
        return watch;
    }

    public static class Watch {
        private WatchMode mode = WatchMode.POLLING;
        private Duration pollInterval = Duration.ofMillis(500);
        private List<String> extensions = List.of("html", "css", "json");

        public WatchMode getMode() {
            return mode;
        }

        public void setMode(WatchMode mode) {
            this.mode = mode;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public List<String> getExtensions() {
            return extensions;
        }

        public void setExtensions(List<String> extensions) {
            this.extensions = extensions;
        }

        /**
         * Extensions lower-cased and stripped of a leading dot, so {@code ".HTML"} and {@code "html"} match alike.
         */
        public Set<String> normalizedExtensions() {
            Set<String> out = new LinkedHashSet<>();
            if (extensions == null) {
                return out;
            }
            for (String ext : extensions) {
                if (ext == null || ext.isBlank()) {
                    continue;
                }
                String e = ext.trim().toLowerCase(Locale.ROOT);
                if (e.startsWith(".")) {
                    e = e.substring(1);
                }
                if (!e.isEmpty()) {
                    out.add(e);
                }
            }
            return out;
        }
    }
}
