package com.zzf.pdfsandbox.watch;

import java.nio.file.Path;

@FunctionalInterface
public interface FileChangeListener {
    void onFileChanged(Path path, boolean directory);
}
