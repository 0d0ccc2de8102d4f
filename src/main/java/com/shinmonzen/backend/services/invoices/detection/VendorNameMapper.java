package com.shinmonzen.backend.services.invoices.detection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw invoice vendor names (Japanese, legacy parser output, OCR misreads) to display names.
 */
public final class VendorNameMapper {

    public static final String UNKNOWN = "Unknown";

    private static final Map<String, String> NAMES = new LinkedHashMap<>();

    static {
        NAMES.put("ミートショップひら山", "Meat Shop Hirayama");
        NAMES.put("ひら山", "Meat Shop Hirayama");
        NAMES.put("株式会社ミートショップひら山", "Meat Shop Hirayama");
        // OCR misreads
        NAMES.put("株式会社ミートショップひらい", "Meat Shop Hirayama");
        NAMES.put("ミートショップひらい", "Meat Shop Hirayama");

        NAMES.put("株式会社 丸弥太", "Maruyata");
        NAMES.put("丸弥太", "Maruyata");
        NAMES.put("有限会社浅見水産", "Asami Suisan");
        NAMES.put("浅見水産", "Asami Suisan");
        NAMES.put("洛北ジビエ イマイ", "Gibier Imai");
        NAMES.put("株式会社銀閣寺大西", "Ginkakuji Onishi");

        NAMES.put("新利根チーズ工房", "Cheese Kobo");
        NAMES.put("タカナシ販売株式会社", "Takanashi");
        NAMES.put("有限会社レチェール・ユゲ", "Yuge Farm");

        NAMES.put("株式会社ポモナファーム", "Pomona Farm");
        NAMES.put("株式会社ミナト　青果事業部", "Minato Seika");
        NAMES.put("株式会社ミナト", "Minato");
        NAMES.put("万松青果株式会社", "Manmatsu");
        NAMES.put("万松青果", "Manmatsu");

        NAMES.put("フレンチ・エフ・アンド・ビー", "French F&B Japan");
        NAMES.put("フレンチ・エフ・アンド・ビー・ジャパン株式会社", "French F&B Japan");
        NAMES.put("French F&B", "French F&B Japan");
        NAMES.put("株式会社 LIBERTE JAPON", "Liberte Japon");
        NAMES.put("LIBERTE JAPON", "Liberte Japon");
        NAMES.put("ＡＳＩＡＭＩＸ株式会社", "Asiamix");

        NAMES.put("株式会社八代目儀兵衛", "Hachidaime Gihei");
        NAMES.put("株式会社進々堂", "Shinshindo");
        NAMES.put("池伝株式会社　大阪支店", "Ikeden");
        NAMES.put("池伝株式会社", "Ikeden");
        NAMES.put("ＷＩＳＫジャパン株式会社", "WISK Japan");
    }

    private VendorNameMapper() {
    }

    public static String cleanName(String rawName) {
        if (rawName == null || rawName.isBlank()) return UNKNOWN;
        String name = rawName.trim();

        String direct = NAMES.get(name);
        if (direct != null) return direct;

        // Partial match either way; single characters would match nearly everything.
        if (name.length() >= 2) {
            for (Map.Entry<String, String> e : NAMES.entrySet()) {
                if (name.contains(e.getKey()) || e.getKey().contains(name)) {
                    return e.getValue();
                }
            }
        }

        return name;
    }
}
