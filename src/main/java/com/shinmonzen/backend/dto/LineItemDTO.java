package com.shinmonzen.backend.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class LineItemDTO {

    private String vendor;
    private LocalDate date;

    @JsonProperty("item_name")
    private String itemName;

    private BigDecimal quantity;
    private String unit;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    private BigDecimal amount;

    public static LineItemDTO from(LineItemRecord record) {
        return LineItemDTO.builder()
                .vendor(record.getVendor())
                .date(record.getDate())
                .itemName(record.getItemName())
                .quantity(record.getQuantity())
                .unit(record.getUnit() != null ? record.getUnit().code() : null)
                .unitPrice(record.getUnitPrice())
                .amount(record.getAmount())
                .build();
    }
}
