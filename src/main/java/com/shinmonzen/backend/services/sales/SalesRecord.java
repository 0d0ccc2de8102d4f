package com.shinmonzen.backend.services.sales;

import java.math.BigDecimal;
import java.time.YearMonth;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One menu item row of a POS product sales report.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SalesRecord {

    private String code;
    private String name;
    private String category;
    private BigDecimal quantity;
    private BigDecimal price;
    private BigDecimal grossTotal;
    private BigDecimal discount;
    private BigDecimal netTotal;

    /**
     * Report period taken from the first "yyyy-MM-dd" in the report header; null when absent.
     */
    private YearMonth month;
}
