package com.shinmonzen.backend.services.invoices.vision;

import java.util.List;

public record VisionDocument(String vendorName, String invoiceDate, List<VisionItem> items) {

    public VisionDocument {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
