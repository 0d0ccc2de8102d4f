package com.shinmonzen.backend.services.invoices.pdf;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import javax.imageio.ImageIO;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Service;

import com.shinmonzen.backend.config.VisionModelProperties;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class PdfPageRenderer {

    private final VisionModelProperties visionProperties;

    /**
     * Renders up to {@code shinmonzen.vision.max-pages} pages. A page that fails to render is
     * skipped and noted in the trace.
     */
    public List<RenderedPage> render(PDDocument document, ExtractionTrace trace) {
        if (document == null) return List.of();

        int dpi = Math.max(72, visionProperties.getRenderDpi());
        int totalPages = document.getNumberOfPages();
        int pagesToRender = Math.min(totalPages, Math.max(1, visionProperties.getMaxPages()));

        long startMs = System.currentTimeMillis();
        PDFRenderer renderer = newRenderer(document);
        List<RenderedPage> pages = new ArrayList<>();

        for (int pageIndex = 0; pageIndex < pagesToRender; pageIndex++) {
            BufferedImage image = null;
            try {
                image = renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB);
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                ImageIO.write(image, "png", out);
                pages.add(new RenderedPage(pageIndex, out.toByteArray()));
            } catch (IOException | RuntimeException e) {
                trace.add("Page {}/{} could not be rendered, skipped: {}", pageIndex + 1, totalPages, e.getMessage());
            } finally {
                if (image != null) image.flush();
            }
        }

        trace.add("Rendered {}/{} pages at {} dpi in {} ms{}",
                pages.size(), totalPages, dpi, System.currentTimeMillis() - startMs,
                totalPages > pagesToRender ? " (page limit " + pagesToRender + ")" : "");
        return pages;
    }

    PDFRenderer newRenderer(PDDocument document) {
        return new PDFRenderer(document);
    }
}
