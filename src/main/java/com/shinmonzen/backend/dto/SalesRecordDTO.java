package com.shinmonzen.backend.dto;

import java.math.BigDecimal;

import com.shinmonzen.backend.services.sales.SalesRecord;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SalesRecordDTO {
    private String code;
    private String name;
    private String category;
    private BigDecimal qty;
    private BigDecimal price;
    private BigDecimal grossTotal;
    private BigDecimal discount;
    private BigDecimal netTotal;
    private String month;

    public static SalesRecordDTO from(SalesRecord record) {
        return SalesRecordDTO.builder()
                .code(record.getCode())
                .name(record.getName())
                .category(record.getCategory())
                .qty(record.getQuantity())
                .price(record.getPrice())
                .grossTotal(record.getGrossTotal())
                .discount(record.getDiscount())
                .netTotal(record.getNetTotal())
                .month(record.getMonth() != null ? record.getMonth().toString() : null)
                .build();
    }
}
