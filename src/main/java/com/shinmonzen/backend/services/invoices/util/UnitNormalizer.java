package com.shinmonzen.backend.services.invoices.util;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.shinmonzen.backend.services.invoices.model.Unit;

/**
 * Unit vocabulary normalization and quantity-to-weight conversion.
 *
 * <p>Recognition is an exact, case-insensitive literal match after the synonym table has been
 * applied. Anything that is not a weight unit (pc, can, box, ..., or an unknown token) is treated
 * as a container and converted with the caller-supplied grams-per-unit. Unknown units therefore
 * never count as one gram.
 */
public final class UnitNormalizer {

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private static final Map<String, Unit> SYNONYMS = Map.ofEntries(
            Map.entry("kg", Unit.KG),
            Map.entry("kgs", Unit.KG),
            Map.entry("kilo", Unit.KG),
            Map.entry("kilogram", Unit.KG),
            Map.entry("キロ", Unit.KG),
            Map.entry("キログラム", Unit.KG),
            Map.entry("g", Unit.G),
            Map.entry("gr", Unit.G),
            Map.entry("gram", Unit.G),
            Map.entry("grams", Unit.G),
            Map.entry("グラム", Unit.G),
            Map.entry("100g", Unit.HUNDRED_G),
            Map.entry("l", Unit.L),
            Map.entry("ℓ", Unit.L),
            Map.entry("liter", Unit.L),
            Map.entry("litre", Unit.L),
            Map.entry("リットル", Unit.L),
            Map.entry("ml", Unit.ML),
            Map.entry("cc", Unit.ML),
            Map.entry("ミリリットル", Unit.ML),
            Map.entry("pc", Unit.PC),
            Map.entry("pcs", Unit.PC),
            Map.entry("piece", Unit.PC),
            Map.entry("pieces", Unit.PC),
            Map.entry("個", Unit.PC),
            Map.entry("本", Unit.PC),
            Map.entry("丁", Unit.PC),
            Map.entry("枚", Unit.PC),
            Map.entry("尾", Unit.PC),
            Map.entry("can", Unit.CAN),
            Map.entry("cans", Unit.CAN),
            Map.entry("缶", Unit.CAN),
            Map.entry("box", Unit.BOX),
            Map.entry("cs", Unit.BOX),
            Map.entry("case", Unit.BOX),
            Map.entry("箱", Unit.BOX),
            Map.entry("ケース", Unit.BOX),
            Map.entry("pack", Unit.PACK),
            Map.entry("pk", Unit.PACK),
            Map.entry("pkt", Unit.PACK),
            Map.entry("パック", Unit.PACK),
            Map.entry("bottle", Unit.BOTTLE),
            Map.entry("btl", Unit.BOTTLE),
            Map.entry("瓶", Unit.BOTTLE),
            Map.entry("ボトル", Unit.BOTTLE),
            Map.entry("jar", Unit.JAR),
            Map.entry("壺", Unit.JAR),
            Map.entry("bag", Unit.BAG),
            Map.entry("袋", Unit.BAG)
    );

    private UnitNormalizer() {
    }

    /**
     * Resolves a raw unit token (Japanese, abbreviated, any case) to the fixed vocabulary.
     */
    public static Optional<Unit> resolve(String raw) {
        if (raw == null) return Optional.empty();
        String key = NormalizeUtil.toHalfWidth(raw).trim().toLowerCase(Locale.ROOT);
        if (key.isEmpty()) return Optional.empty();

        Unit synonym = SYNONYMS.get(key);
        if (synonym != null) return Optional.of(synonym);
        return Unit.fromCode(key);
    }

    /**
     * Unit for a canonical record: blank and unknown tokens become {@link Unit#PC}.
     */
    public static Unit normalizeUnit(String raw) {
        return resolve(raw).orElse(Unit.PC);
    }

    public static boolean isWeightUnit(String raw) {
        return resolve(raw).map(Unit::isWeight).orElse(false);
    }

    /**
     * kg -> x1000, 100g -> x100, g -> x1, everything else -> x defaultGramsPerUnit.
     */
    public static BigDecimal toGrams(BigDecimal quantity, String unit, BigDecimal defaultGramsPerUnit) {
        if (quantity == null) return BigDecimal.ZERO;
        return quantity.multiply(gramsPerUnit(unit, defaultGramsPerUnit));
    }

    public static BigDecimal toGrams(BigDecimal quantity, Unit unit, BigDecimal defaultGramsPerUnit) {
        return toGrams(quantity, unit == null ? null : unit.code(), defaultGramsPerUnit);
    }

    /**
     * Inverse of {@link #toGrams(BigDecimal, String, BigDecimal)}.
     */
    public static BigDecimal fromGrams(BigDecimal grams, String unit, BigDecimal defaultGramsPerUnit) {
        if (grams == null) return BigDecimal.ZERO;
        BigDecimal factor = gramsPerUnit(unit, defaultGramsPerUnit);
        if (factor.signum() == 0) return BigDecimal.ZERO;
        return grams.divide(factor, MathContext.DECIMAL64);
    }

    private static BigDecimal gramsPerUnit(String unit, BigDecimal defaultGramsPerUnit) {
        Unit resolved = resolve(unit).orElse(null);
        if (resolved == Unit.KG) return THOUSAND;
        if (resolved == Unit.HUNDRED_G) return HUNDRED;
        if (resolved == Unit.G) return BigDecimal.ONE;
        return Objects.requireNonNull(defaultGramsPerUnit, "defaultGramsPerUnit is required for container unit " + unit);
    }
}
