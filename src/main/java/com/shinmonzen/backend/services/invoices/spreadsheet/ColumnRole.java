package com.shinmonzen.backend.services.invoices.spreadsheet;

import java.util.List;

import com.shinmonzen.backend.services.invoices.util.NormalizeUtil;

/**
 * Header keyword groups, declared in matching priority order: a header takes the first role whose
 * keywords it contains ("total price" is an amount, "unit price" is a unit price before it is a unit).
 */
public enum ColumnRole {
    DATE(List.of("日付", "納品日", "伝票日付", "年月日", "date")),
    VENDOR(List.of("仕入先", "取引先", "業者", "vendor", "supplier")),
    AMOUNT(List.of("金額", "合計", "小計", "amount", "total")),
    UNIT_PRICE(List.of("単価", "unit price", "unit_price", "price")),
    QUANTITY(List.of("数量", "入数", "qty", "quantity")),
    UNIT(List.of("単位", "unit")),
    ITEM_NAME(List.of("品名", "商品名", "品目", "商品", "item", "product", "description", "name"));

    private final List<String> keywords;

    ColumnRole(List<String> keywords) {
        this.keywords = keywords;
    }

    public List<String> keywords() {
        return keywords;
    }

    public static ColumnRole match(String header) {
        if (header == null || header.isBlank()) return null;
        String h = NormalizeUtil.normalize(header);
        for (ColumnRole role : values()) {
            for (String keyword : role.keywords) {
                if (h.contains(keyword)) return role;
            }
        }
        return null;
    }
}
