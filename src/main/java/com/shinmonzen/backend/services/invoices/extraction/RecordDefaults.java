package com.shinmonzen.backend.services.invoices.extraction;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.detection.VendorNameMapper;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.model.Unit;
import com.shinmonzen.backend.services.invoices.util.AmountParser;
import com.shinmonzen.backend.services.invoices.util.InvoiceDates;

import lombok.RequiredArgsConstructor;

/**
 * The single place where missing per-line fields are inherited from the document and where
 * noise lines are dropped. Parsers emit raw candidates; everything returned from the pipeline
 * passes through {@link #apply}.
 *
 * <ul>
 *   <li>vendor: document vendor, else "Unknown"</li>
 *   <li>date: document date, else the first day of the current month</li>
 *   <li>unit: {@code pc}</li>
 *   <li>amount: quantity x unit price</li>
 *   <li>quantity: amount / unit price, else 1</li>
 *   <li>unit price: amount / quantity</li>
 * </ul>
 * Records with a zero amount or zero quantity are always dropped. A negative amount, quantity or
 * unit price marks a return or credit line; those only survive, with quantity and unit price made
 * non-negative, when {@code shinmonzen.extraction.keep-negative-amounts} is set.
 */
@Component
@RequiredArgsConstructor
public class RecordDefaults {

    private final ExtractionProperties extractionProperties;
    private final Clock clock;

    public List<LineItemRecord> apply(List<LineItemRecord> candidates, String documentVendor, LocalDate documentDate,
            ExtractionTrace trace) {
        if (candidates == null || candidates.isEmpty()) return List.of();

        String vendorDefault = documentVendor == null || documentVendor.isBlank()
                ? VendorNameMapper.UNKNOWN
                : documentVendor.trim();
        LocalDate dateDefault = documentDate != null ? documentDate : InvoiceDates.firstOfCurrentMonth(clock);

        List<LineItemRecord> out = new ArrayList<>();
        int droppedNoName = 0;
        int droppedZero = 0;
        int droppedNegative = 0;

        for (LineItemRecord candidate : candidates) {
            if (candidate == null) continue;
            if (candidate.getItemName() == null || candidate.getItemName().isBlank()) {
                droppedNoName++;
                continue;
            }

            LineItemRecord r = fill(candidate, vendorDefault, dateDefault);

            if (AmountParser.isZero(r.getAmount()) || AmountParser.isZero(r.getQuantity())) {
                droppedZero++;
                continue;
            }
            if (isNegative(r)) {
                if (!extractionProperties.isKeepNegativeAmounts()) {
                    droppedNegative++;
                    continue;
                }
                r.setQuantity(r.getQuantity().abs());
                r.setUnitPrice(r.getUnitPrice() == null ? null : r.getUnitPrice().abs());
            }
            out.add(r);
        }

        if (trace != null) {
            trace.add("Defaults applied: {} kept, {} dropped (zero amount/quantity), {} dropped (negative), {} dropped (no item name)",
                    out.size(), droppedZero, droppedNegative, droppedNoName);
        }
        return out;
    }

    private static boolean isNegative(LineItemRecord r) {
        return r.getAmount().signum() < 0
                || r.getQuantity().signum() < 0
                || (r.getUnitPrice() != null && r.getUnitPrice().signum() < 0);
    }

    private LineItemRecord fill(LineItemRecord candidate, String vendorDefault, LocalDate dateDefault) {
        LineItemRecord r = candidate.toBuilder().build();

        if (r.getVendor() == null || r.getVendor().isBlank()) {
            r.setVendor(vendorDefault);
        }
        if (r.getDate() == null) {
            r.setDate(dateDefault);
        }
        if (r.getUnit() == null) {
            r.setUnit(Unit.PC);
        }
        r.setItemName(r.getItemName().trim());

        BigDecimal quantity = r.getQuantity();
        BigDecimal unitPrice = r.getUnitPrice();
        BigDecimal amount = r.getAmount();

        if (amount == null && quantity != null && unitPrice != null) {
            amount = quantity.multiply(unitPrice).setScale(0, RoundingMode.HALF_UP);
        }
        if (quantity == null) {
            if (amount != null && unitPrice != null && unitPrice.signum() != 0) {
                quantity = amount.divide(unitPrice, 3, RoundingMode.HALF_UP).stripTrailingZeros();
            } else {
                quantity = BigDecimal.ONE;
            }
        }
        if ((unitPrice == null || unitPrice.signum() == 0) && amount != null && quantity.signum() != 0) {
            unitPrice = amount.divide(quantity, 2, RoundingMode.HALF_UP);
        }

        r.setQuantity(quantity);
        r.setUnitPrice(unitPrice);
        r.setAmount(amount);
        return r;
    }
}
