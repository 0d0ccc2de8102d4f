package com.shinmonzen.backend.services.invoices.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.shinmonzen.backend.services.invoices.model.Unit;

class UnitNormalizerTest {

    private static final BigDecimal CAN_GRAMS = BigDecimal.valueOf(100);

    @Test
    void weightUnitsConvertToGrams() {
        assertEquals(0, UnitNormalizer.toGrams(new BigDecimal("6.30"), "kg", CAN_GRAMS).compareTo(new BigDecimal("6300")));
        assertEquals(0, UnitNormalizer.toGrams(new BigDecimal("3"), "100g", CAN_GRAMS).compareTo(new BigDecimal("300")));
        assertEquals(0, UnitNormalizer.toGrams(new BigDecimal("250"), "g", CAN_GRAMS).compareTo(new BigDecimal("250")));
        assertEquals(0, UnitNormalizer.toGrams(new BigDecimal("2"), "キログラム", CAN_GRAMS).compareTo(new BigDecimal("2000")));
    }

    @Test
    void gramsRoundTripForEveryWeightUnit() {
        List<BigDecimal> samples = List.of(new BigDecimal("0.125"), new BigDecimal("6.3"), new BigDecimal("1234.5"));
        for (String unit : List.of("kg", "g", "100g")) {
            for (BigDecimal x : samples) {
                BigDecimal back = UnitNormalizer.toGrams(UnitNormalizer.fromGrams(x, unit, CAN_GRAMS), unit, CAN_GRAMS);
                assertEquals(0, back.compareTo(x), unit + " " + x);
            }
        }
    }

    @Test
    void containersUseTheSuppliedDefaultEvenForLargeCounts() {
        BigDecimal n = new BigDecimal("1000000");
        assertEquals(0, UnitNormalizer.toGrams(n, "can", CAN_GRAMS).compareTo(new BigDecimal("100000000")));
        assertEquals(0, UnitNormalizer.toGrams(new BigDecimal("22"), "缶", CAN_GRAMS).compareTo(new BigDecimal("2200")));
    }

    @Test
    void unknownUnitBehavesLikeCan() {
        BigDecimal n = new BigDecimal("7");
        BigDecimal asCan = UnitNormalizer.toGrams(n, "can", CAN_GRAMS);
        assertEquals(0, UnitNormalizer.toGrams(n, "tin-ish", CAN_GRAMS).compareTo(asCan));
        assertEquals(0, UnitNormalizer.toGrams(n, (String) null, CAN_GRAMS).compareTo(asCan));
    }

    @Test
    void containerWithoutDefaultIsRejected() {
        assertThrows(NullPointerException.class, () -> UnitNormalizer.toGrams(BigDecimal.ONE, "can", null));
    }

    @Test
    void synonymsNormalizeIntoFixedVocabulary() {
        assertEquals(Unit.KG, UnitNormalizer.normalizeUnit("KGS"));
        assertEquals(Unit.PC, UnitNormalizer.normalizeUnit("個"));
        assertEquals(Unit.PC, UnitNormalizer.normalizeUnit("本"));
        assertEquals(Unit.CAN, UnitNormalizer.normalizeUnit("缶"));
        assertEquals(Unit.BOX, UnitNormalizer.normalizeUnit("ケース"));
        assertEquals(Unit.PACK, UnitNormalizer.normalizeUnit("パック"));
        assertEquals(Unit.BAG, UnitNormalizer.normalizeUnit("袋"));
        assertEquals(Unit.L, UnitNormalizer.normalizeUnit("リットル"));
        assertEquals(Unit.PC, UnitNormalizer.normalizeUnit(""));
        assertEquals(Unit.PC, UnitNormalizer.normalizeUnit("???"));
    }

    @Test
    void onlyKgGramsAndHundredGramsAreWeights() {
        assertTrue(UnitNormalizer.isWeightUnit("kg"));
        assertTrue(UnitNormalizer.isWeightUnit("グラム"));
        assertTrue(UnitNormalizer.isWeightUnit("100g"));
        assertFalse(UnitNormalizer.isWeightUnit("can"));
        assertFalse(UnitNormalizer.isWeightUnit("ml"));
    }
}
