package com.zzf.pdfsandbox.render;

import java.nio.file.Path;

public interface DocumentRenderer {

    /**
     * Writes the document for {@code markup} to {@code outputPath}. Relative resource references in the
     * markup resolve against {@code baseUrl}.
     */
    void render(String markup, Path outputPath, String baseUrl) throws RenderException;
}
