package com.shinmonzen.backend.services.invoices.vision;

/**
 * One item as returned by the model. Values stay raw strings; the model mixes numbers,
 * "12,000" and "¥12,000" freely, so conversion happens in {@link VisionExtractor}.
 */
public record VisionItem(
        String date,
        String itemName,
        String quantity,
        String unit,
        String unitPrice,
        String amount) {
}
