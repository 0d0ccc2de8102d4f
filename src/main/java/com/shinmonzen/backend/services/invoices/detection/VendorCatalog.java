package com.shinmonzen.backend.services.invoices.detection;

import java.util.List;

/**
 * Ordered, read-only vendor table. Order matters: detection is "first match wins".
 */
public final class VendorCatalog {

    private final List<VendorPattern> patterns;

    public VendorCatalog(List<VendorPattern> patterns) {
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
    }

    public List<VendorPattern> getPatterns() {
        return patterns;
    }

    public static VendorCatalog defaults() {
        return new VendorCatalog(List.of(
                new VendorPattern("Meat Shop Hirayama",
                        List.of("ミートショップひら山", "ひら山", "hirayama", "和牛ヒレ"),
                        ExtractionStrategy.HIRAYAMA),
                new VendorPattern("Maruyata",
                        List.of("丸弥太", "maruyata"),
                        ExtractionStrategy.MARUYATA),
                new VendorPattern("French F&B Japan",
                        List.of("フレンチ・エフ・アンド・ビー", "french f&b", "french fnb", "french_fnb", "kaviari", "キャビア"),
                        ExtractionStrategy.FRENCH_FNB),
                new VendorPattern("Asami Suisan", List.of("浅見水産", "asami"), ExtractionStrategy.AI),
                new VendorPattern("Gibier Imai", List.of("洛北ジビエ", "イマイ", "gibier", "imai"), ExtractionStrategy.AI),
                new VendorPattern("Cheese Kobo", List.of("新利根チーズ", "cheese kobo"), ExtractionStrategy.AI),
                new VendorPattern("Takanashi", List.of("タカナシ", "takanashi"), ExtractionStrategy.AI),
                new VendorPattern("Pomona Farm", List.of("ポモナ", "pomona"), ExtractionStrategy.AI),
                new VendorPattern("Minato", List.of("ミナト", "minato"), ExtractionStrategy.AI),
                new VendorPattern("Ginkakuji Onishi", List.of("銀閣寺大西", "ginkakuji", "onishi"), ExtractionStrategy.AI)
        ));
    }
}
