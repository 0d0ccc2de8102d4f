package com.shinmonzen.backend.services.invoices.vision;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.springframework.stereotype.Service;

import com.shinmonzen.backend.services.invoices.detection.VendorNameMapper;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionSession;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionTrace;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.pdf.PdfPageRenderer;
import com.shinmonzen.backend.services.invoices.pdf.RenderedPage;
import com.shinmonzen.backend.services.invoices.util.AmountParser;
import com.shinmonzen.backend.services.invoices.util.InvoiceDates;
import com.shinmonzen.backend.services.invoices.util.NormalizeUtil;
import com.shinmonzen.backend.services.invoices.util.UnitNormalizer;

import lombok.RequiredArgsConstructor;

/**
 * Last step of the escalation chain. Any failure here ends in zero records; nothing is retried.
 */
@Service
@RequiredArgsConstructor
public class VisionExtractor {

    private final VisionModelClient visionModelClient;
    private final PdfPageRenderer pageRenderer;

    /**
     * Returns candidate records (defaults not yet applied). The document-level vendor and date from
     * the response header are stored on the session.
     */
    public List<LineItemRecord> extract(PDDocument document, ExtractionSession session) {
        ExtractionTrace trace = session.getTrace();
        trace.add("Vision model extraction attempted");

        if (!visionModelClient.isAvailable()) {
            String reason = visionModelClient instanceof DisabledVisionModelClient disabled
                    ? disabled.getReason()
                    : "client unavailable";
            trace.add("Vision model unavailable ({}), zero records", reason);
            return List.of();
        }

        List<RenderedPage> pages = pageRenderer.render(document, trace);
        if (pages.isEmpty()) {
            trace.add("No page could be rendered, zero records");
            return List.of();
        }

        String response;
        try {
            response = visionModelClient.complete(VisionPrompt.INSTRUCTIONS, pages);
        } catch (RuntimeException e) {
            trace.add("Vision model call failed, zero records: {}", e.getMessage());
            return List.of();
        }
        trace.add("Vision model response: {} characters for {} pages", response == null ? 0 : response.length(), pages.size());

        Optional<RepairedResponse> repaired = VisionResponseRepair.repair(response);
        if (repaired.isEmpty()) {
            trace.add("Response unparseable after direct parse, object scan and bracket closure, zero records");
            return List.of();
        }

        VisionDocument parsed = repaired.get().document();
        trace.add("Response parsed at stage {} with {} items (vendor='{}', invoice_date='{}')",
                repaired.get().stage(), parsed.items().size(), parsed.vendorName(), parsed.invoiceDate());

        String vendor = parsed.vendorName() != null ? VendorNameMapper.cleanName(parsed.vendorName()) : null;
        LocalDate invoiceDate = InvoiceDates.parseFlexible(parsed.invoiceDate());
        if (vendor != null) session.setDocumentVendor(vendor);
        if (invoiceDate != null) session.setDocumentDate(invoiceDate);

        return toRecords(parsed, vendor, invoiceDate);
    }

    static List<LineItemRecord> toRecords(VisionDocument parsed, String vendor, LocalDate invoiceDate) {
        List<LineItemRecord> out = new ArrayList<>();
        for (VisionItem item : parsed.items()) {
            String name = NormalizeUtil.blankToNull(item.itemName());
            if (name == null) continue;

            LocalDate date = InvoiceDates.parseFlexible(item.date());
            out.add(LineItemRecord.builder()
                    .vendor(vendor)
                    .date(date != null ? date : invoiceDate)
                    .itemName(name)
                    .quantity(AmountParser.parse(item.quantity()))
                    .unit(UnitNormalizer.normalizeUnit(item.unit()))
                    .unitPrice(AmountParser.parse(item.unitPrice()))
                    .amount(AmountParser.parse(item.amount()))
                    .build());
        }
        return out;
    }
}
