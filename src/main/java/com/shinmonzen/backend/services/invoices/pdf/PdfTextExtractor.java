package com.shinmonzen.backend.services.invoices.pdf;

import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class PdfTextExtractor {

    private final ExtractionProperties properties;

    /**
     * Reads the text layer page by page so that one broken page only blanks itself.
     */
    public TextLayer extract(PDDocument document, ExtractionTrace trace) throws IOException {
        int pages = document.getNumberOfPages();
        PDFTextStripper stripper = newStripper();
        stripper.setSortByPosition(true);

        StringBuilder sb = new StringBuilder();
        int unreadable = 0;
        for (int page = 1; page <= pages; page++) {
            stripper.setStartPage(page);
            stripper.setEndPage(page);
            try {
                sb.append(stripper.getText(document)).append('\n');
            } catch (IOException | RuntimeException e) {
                unreadable++;
                trace.add("Page {}/{} text extraction failed, treated as empty: {}", page, pages, e.getMessage());
            }
        }

        String text = sb.toString();
        int length = text.strip().length();
        boolean scanned = length < properties.getScannedTextThreshold();
        trace.add("Text layer: {} pages, {} characters, scanned={} (threshold {})",
                pages, length, scanned, properties.getScannedTextThreshold());
        return new TextLayer(text, pages, unreadable, scanned);
    }

    PDFTextStripper newStripper() throws IOException {
        return new PDFTextStripper();
    }
}
