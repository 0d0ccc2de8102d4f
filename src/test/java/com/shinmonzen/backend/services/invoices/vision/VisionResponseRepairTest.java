package com.shinmonzen.backend.services.invoices.vision;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

class VisionResponseRepairTest {

    private static String item(String name, String amount) {
        return "{\"date\": \"2025-10-01\", \"item_name\": \"" + name + "\", \"quantity\": \"1\", \"unit\": \"kg\", "
                + "\"unit_price\": \"" + amount + "\", \"amount\": \"" + amount + "\"}";
    }

    @Test
    void completeResponseParsesDirectly() {
        String raw = "{\"vendor_name\": \"有限会社浅見水産\", \"invoice_date\": \"2025-10-31\", \"items\": ["
                + item("真鯛", "3200") + ", " + item("平目", "4800") + "]}";

        RepairedResponse repaired = VisionResponseRepair.repair(raw).orElseThrow();

        assertEquals(RepairStage.DIRECT, repaired.stage());
        assertEquals("有限会社浅見水産", repaired.document().vendorName());
        assertEquals("2025-10-31", repaired.document().invoiceDate());
        assertEquals(2, repaired.document().items().size());
        assertEquals("4800", repaired.document().items().get(1).amount());
    }

    @Test
    void codeFencesAreStripped() {
        String raw = "```json\n{\"vendor_name\": \"Minato\", \"items\": [" + item("ウニ", "9000") + "]}\n```";

        RepairedResponse repaired = VisionResponseRepair.repair(raw).orElseThrow();

        assertEquals(RepairStage.DIRECT, repaired.stage());
        assertEquals(1, repaired.document().items().size());
    }

    @Test
    void truncatedResponseKeepsEveryCompleteItem() {
        String raw = "{\"vendor_name\": \"株式会社丸弥太\", \"invoice_date\": \"2025-10-31\", \"items\": ["
                + item("本マグロ", "11000") + ", "
                + item("真鯛", "6400") + ", "
                + item("ウニ", "27000") + ", "
                + "{\"date\": \"2025-10-0";

        RepairedResponse repaired = VisionResponseRepair.repair(raw).orElseThrow();

        assertEquals(RepairStage.OBJECT_SCAN, repaired.stage());
        assertEquals(3, repaired.document().items().size());
        assertEquals("株式会社丸弥太", repaired.document().vendorName());
        assertEquals("ウニ", repaired.document().items().get(2).itemName());
    }

    @Test
    void numericValuesAreReadAsText() {
        String raw = "{\"items\": [{\"item_name\": \"バター\", \"quantity\": 10, \"amount\": 6800.5}]}";

        VisionItem parsed = VisionResponseRepair.repair(raw).orElseThrow().document().items().get(0);

        assertEquals("10", parsed.quantity());
        assertEquals("6800.5", parsed.amount());
        assertNull(parsed.unit());
    }

    @Test
    void bracketClosureCutsAfterLastCompleteItem() {
        String raw = "{\"vendor_name\": \"Pomona\", \"items\": [{\"item_name\": \"りんご\", \"amount\": \"1200\"},"
                + " {\"item_name\": \"なし\", \"amou";

        Optional<VisionDocument> closed = VisionResponseRepair.closeBrackets(raw);

        assertTrue(closed.isPresent());
        assertEquals(1, closed.get().items().size());
        assertEquals("Pomona", closed.get().vendorName());
    }

    @Test
    void garbageYieldsNothing() {
        assertTrue(VisionResponseRepair.repair("I could not read this invoice.").isEmpty());
        assertTrue(VisionResponseRepair.repair("").isEmpty());
        assertTrue(VisionResponseRepair.repair(null).isEmpty());
    }
}
