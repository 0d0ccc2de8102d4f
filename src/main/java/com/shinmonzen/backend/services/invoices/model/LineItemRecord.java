package com.shinmonzen.backend.services.invoices.model;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Canonical line item every extraction path converges on.
 *
 * Parsers may leave fields null; {@link com.shinmonzen.backend.services.invoices.extraction.RecordDefaults}
 * fills them from the document context before the record leaves the pipeline.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LineItemRecord {
    private String vendor;
    private LocalDate date;
    private String itemName;
    private BigDecimal quantity;
    private Unit unit;
    private BigDecimal unitPrice;
    private BigDecimal amount;
}
