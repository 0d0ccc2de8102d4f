package com.shinmonzen.backend.dto;

import java.util.List;

import com.shinmonzen.backend.services.invoices.extraction.ExtractionResult;
import com.shinmonzen.backend.services.invoices.extraction.StrategyAttempt;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ExtractionResponseDTO {

    private String filename;
    private String vendor;
    private String strategy;
    private Boolean scanned;
    private int totalRecords;
    private List<LineItemDTO> records;
    private List<StrategyAttempt> attempts;
    private List<String> trace;

    public static ExtractionResponseDTO from(ExtractionResult result) {
        return ExtractionResponseDTO.builder()
                .filename(result.filename())
                .vendor(result.vendor())
                .strategy(result.strategy() != null ? result.strategy().id() : null)
                .scanned(result.scanned())
                .totalRecords(result.records().size())
                .records(result.records().stream().map(LineItemDTO::from).toList())
                .attempts(result.attempts())
                .trace(result.trace())
                .build();
    }
}
