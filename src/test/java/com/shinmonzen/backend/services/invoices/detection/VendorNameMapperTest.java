package com.shinmonzen.backend.services.invoices.detection;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class VendorNameMapperTest {

    @Test
    void exactNameMapsToDisplayName() {
        assertEquals("Meat Shop Hirayama", VendorNameMapper.cleanName("株式会社ミートショップひら山"));
        assertEquals("French F&B Japan", VendorNameMapper.cleanName("French F&B"));
    }

    @Test
    void ocrVariantMapsToSameVendor() {
        assertEquals("Meat Shop Hirayama", VendorNameMapper.cleanName("株式会社ミートショップひらい"));
    }

    @Test
    void partialMatchWorksBothWays() {
        assertEquals("Maruyata", VendorNameMapper.cleanName("丸弥太 水産部"));
        assertEquals("Asami Suisan", VendorNameMapper.cleanName("浅見"));
    }

    @Test
    void unknownNamesPassThroughTrimmed() {
        assertEquals("Le Petit Fournisseur", VendorNameMapper.cleanName("  Le Petit Fournisseur "));
        assertEquals(VendorNameMapper.UNKNOWN, VendorNameMapper.cleanName("   "));
        assertEquals(VendorNameMapper.UNKNOWN, VendorNameMapper.cleanName(null));
    }
}
