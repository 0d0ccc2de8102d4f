package com.shinmonzen.backend.services.invoices.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.shinmonzen.backend.config.ExtractionProperties;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.model.Unit;

class RecordDefaultsTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-11-15T03:00:00Z"), ZoneOffset.UTC);

    private final ExtractionProperties properties = new ExtractionProperties();
    private final RecordDefaults defaults = new RecordDefaults(properties, CLOCK);

    @Test
    void missingFieldsAreInheritedFromTheDocument() {
        LineItemRecord candidate = LineItemRecord.builder()
                .itemName("  真鯛 ")
                .unitPrice(new BigDecimal("3200"))
                .amount(new BigDecimal("6400"))
                .build();

        List<LineItemRecord> out = defaults.apply(List.of(candidate), "Asami Suisan", LocalDate.of(2025, 10, 31), null);

        assertEquals(1, out.size());
        LineItemRecord r = out.get(0);
        assertEquals("Asami Suisan", r.getVendor());
        assertEquals(LocalDate.of(2025, 10, 31), r.getDate());
        assertEquals("真鯛", r.getItemName());
        assertEquals(Unit.PC, r.getUnit());
        assertEquals(0, r.getQuantity().compareTo(new BigDecimal("2")));
    }

    @Test
    void withoutDocumentContextFallsBackToUnknownAndCurrentMonth() {
        LineItemRecord candidate = LineItemRecord.builder()
                .itemName("ブリ")
                .amount(new BigDecimal("3000"))
                .build();

        LineItemRecord r = defaults.apply(List.of(candidate), null, null, null).get(0);

        assertEquals("Unknown", r.getVendor());
        assertEquals(LocalDate.of(2025, 11, 1), r.getDate());
        assertEquals(0, r.getQuantity().compareTo(BigDecimal.ONE));
        assertEquals(0, r.getUnitPrice().compareTo(new BigDecimal("3000")));
    }

    @Test
    void amountIsComputedFromQuantityAndPrice() {
        LineItemRecord candidate = LineItemRecord.builder()
                .itemName("和牛ヒレ")
                .quantity(new BigDecimal("6.30"))
                .unit(Unit.KG)
                .unitPrice(new BigDecimal("12000"))
                .build();

        LineItemRecord r = defaults.apply(List.of(candidate), "Meat Shop Hirayama", null, null).get(0);

        assertEquals(0, r.getAmount().compareTo(new BigDecimal("75600")));
    }

    @Test
    void zeroAndNegativeAmountsAreDropped() {
        List<LineItemRecord> candidates = List.of(
                LineItemRecord.builder().itemName("送料").amount(BigDecimal.ZERO).build(),
                LineItemRecord.builder().itemName("返品").quantity(BigDecimal.ONE).amount(new BigDecimal("-3000")).build(),
                LineItemRecord.builder().itemName(" ").amount(new BigDecimal("100")).build(),
                LineItemRecord.builder().itemName("ウニ").amount(new BigDecimal("9000")).build());
        ExtractionTrace trace = ExtractionTrace.newTrace();

        List<LineItemRecord> out = defaults.apply(candidates, "Minato", null, trace);

        assertEquals(1, out.size());
        assertEquals("ウニ", out.get(0).getItemName());
        assertTrue(trace.entries().get(0).contains("1 kept, 1 dropped (zero amount/quantity), 1 dropped (negative), 1 dropped (no item name)"));
    }

    @Test
    void negativeQuantityWithPositiveAmountIsDropped() {
        LineItemRecord returned = LineItemRecord.builder()
                .itemName("和牛サーロイン")
                .quantity(new BigDecimal("-2"))
                .amount(new BigDecimal("3000"))
                .build();
        ExtractionTrace trace = ExtractionTrace.newTrace();

        assertTrue(defaults.apply(List.of(returned), "Meat Shop Hirayama", null, trace).isEmpty());
        assertTrue(trace.entries().get(0).contains("1 dropped (negative)"));
    }

    @Test
    void negativeQuantityIsMadePositiveWhenNegativesAreKept() {
        properties.setKeepNegativeAmounts(true);
        LineItemRecord returned = LineItemRecord.builder()
                .itemName("和牛サーロイン")
                .quantity(new BigDecimal("-2"))
                .amount(new BigDecimal("3000"))
                .build();

        LineItemRecord r = defaults.apply(List.of(returned), "Meat Shop Hirayama", null, null).get(0);

        assertEquals(0, r.getQuantity().compareTo(new BigDecimal("2")));
        assertEquals(0, r.getUnitPrice().compareTo(new BigDecimal("1500")));
        assertEquals(0, r.getAmount().compareTo(new BigDecimal("3000")));
    }

    @Test
    void negativeAmountsSurviveWhenConfigured() {
        properties.setKeepNegativeAmounts(true);
        LineItemRecord credit = LineItemRecord.builder()
                .itemName("返品")
                .quantity(new BigDecimal("-2"))
                .unitPrice(new BigDecimal("-1500"))
                .amount(new BigDecimal("-3000"))
                .build();

        LineItemRecord r = defaults.apply(List.of(credit), "Minato", null, null).get(0);

        assertEquals(0, r.getAmount().compareTo(new BigDecimal("-3000")));
        assertEquals(0, r.getQuantity().compareTo(new BigDecimal("2")));
        assertEquals(0, r.getUnitPrice().compareTo(new BigDecimal("1500")));
    }

    @Test
    void candidatesAreNotMutated() {
        LineItemRecord candidate = LineItemRecord.builder().itemName("ウニ").amount(new BigDecimal("9000")).build();

        defaults.apply(List.of(candidate), "Minato", null, null);

        assertEquals(null, candidate.getVendor());
        assertEquals(null, candidate.getQuantity());
    }
}
