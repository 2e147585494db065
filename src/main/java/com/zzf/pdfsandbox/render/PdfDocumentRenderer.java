package com.zzf.pdfsandbox.render;

import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.helper.W3CDom;
import org.jsoup.nodes.Document;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * HTML to PDF through openhtmltopdf. The markup is parsed leniently with jsoup first, since the
 * renderer itself only accepts well-formed XHTML.
 */
@Slf4j
public class PdfDocumentRenderer implements DocumentRenderer {

    @Override
    public void render(String markup, Path outputPath, String baseUrl) throws RenderException {
        long start = System.nanoTime();
        try {
            Document parsed = Jsoup.parse(markup == null ? "" : markup, baseUrl == null ? "" : baseUrl);
            org.w3c.dom.Document document = new W3CDom().fromJsoup(parsed);
            try (OutputStream out = Files.newOutputStream(outputPath)) {
                PdfRendererBuilder builder = new PdfRendererBuilder();
                builder.useFastMode();
                builder.withW3cDocument(document, baseUrl);
                builder.toStream(out);
                builder.run();
            }
        } catch (IOException | RuntimeException e) {
            throw new RenderException("PDF generation failed: " + e.getMessage(), e);
        }
        log.debug("render.pdf.ok output={} tookMs={}", outputPath.getFileName(), (System.nanoTime() - start) / 1_000_000);
    }
}
