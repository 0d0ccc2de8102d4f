package com.shinmonzen.backend.services.invoices.model;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fixed unit vocabulary of a canonical line item.
 */
public enum Unit {
    KG("kg", true),
    G("g", true),
    HUNDRED_G("100g", true),
    L("L", false),
    ML("ml", false),
    PC("pc", false),
    CAN("can", false),
    BOX("box", false),
    PACK("pack", false),
    BOTTLE("bottle", false),
    JAR("jar", false),
    BAG("bag", false);

    private final String code;
    private final boolean weight;

    Unit(String code, boolean weight) {
        this.code = code;
        this.weight = weight;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public boolean isWeight() {
        return weight;
    }

    /**
     * Exact, case-insensitive lookup against the unit codes. No synonym handling here;
     * see {@link com.shinmonzen.backend.services.invoices.util.UnitNormalizer#normalizeUnit(String)}.
     */
    public static Optional<Unit> fromCode(String code) {
        if (code == null) return Optional.empty();
        String c = code.trim().toLowerCase(Locale.ROOT);
        for (Unit u : values()) {
            if (u.code.toLowerCase(Locale.ROOT).equals(c)) {
                return Optional.of(u);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return code;
    }
}
