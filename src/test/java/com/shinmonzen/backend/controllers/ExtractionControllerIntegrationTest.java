package com.shinmonzen.backend.controllers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;
import com.shinmonzen.backend.services.invoices.extraction.DocumentUpload;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionBatchService;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionPipeline;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionResult;
import com.shinmonzen.backend.services.invoices.extraction.StrategyAttempt;
import com.shinmonzen.backend.services.invoices.model.LineItemRecord;
import com.shinmonzen.backend.services.invoices.model.Unit;

@SpringBootTest
@AutoConfigureMockMvc
class ExtractionControllerIntegrationTest {

    @Autowired
    MockMvc mockMvc;

    @MockBean
    ExtractionPipeline extractionPipeline;

    @MockBean
    ExtractionBatchService extractionBatchService;

    private static ExtractionResult hirayamaResult(String filename) {
        LineItemRecord record = LineItemRecord.builder()
                .vendor("Meat Shop Hirayama")
                .date(LocalDate.of(2025, 10, 9))
                .itemName("和牛ヒレ")
                .quantity(new BigDecimal("6.30"))
                .unit(Unit.KG)
                .unitPrice(new BigDecimal("12000"))
                .amount(new BigDecimal("75600"))
                .build();
        return new ExtractionResult(filename, "Meat Shop Hirayama", ExtractionStrategy.HIRAYAMA, false,
                List.of(record), List.of(StrategyAttempt.success("hirayama", 1, null)), List.of("Session started"));
    }

    @Test
    void upload_returnsRecordsAndTrace() throws Exception {
        MockMultipartFile file = new MockMultipartFile(
                "file", "hirayama_2025-10.pdf", "application/pdf", new byte[] { 1, 2, 3 });
        when(extractionPipeline.extract(eq("hirayama_2025-10.pdf"), any())).thenReturn(hirayamaResult("hirayama_2025-10.pdf"));

        mockMvc.perform(multipart("/api/extractions").file(file))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.strategy").value("hirayama"))
                .andExpect(jsonPath("$.data.totalRecords").value(1))
                .andExpect(jsonPath("$.data.records[0].item_name").value("和牛ヒレ"))
                .andExpect(jsonPath("$.data.records[0].unit").value("kg"))
                .andExpect(jsonPath("$.data.records[0].date").value("2025-10-09"))
                .andExpect(jsonPath("$.data.trace[0]").value("Session started"))
                .andExpect(jsonPath("$.errors").doesNotExist());
    }

    @Test
    void upload_emptyFileIsRejected() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);

        mockMvc.perform(multipart("/api/extractions").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("File missing or empty"))
                .andExpect(jsonPath("$.errors[0]").value("File missing or empty"))
                .andExpect(jsonPath("$.data").doesNotExist());

        verify(extractionPipeline, never()).extract(anyString(), any());
    }

    @Test
    void upload_missingPartIsRejected() throws Exception {
        mockMvc.perform(multipart("/api/extractions"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void batch_returnsOneResultPerFile() throws Exception {
        MockMultipartFile first = new MockMultipartFile("files", "a.pdf", "application/pdf", new byte[] { 1 });
        MockMultipartFile second = new MockMultipartFile("files", "b.csv", "text/csv", new byte[] { 2 });
        when(extractionBatchService.extractAll(anyList())).thenReturn(List.of(
                hirayamaResult("a.pdf"),
                new ExtractionResult("b.csv", null, ExtractionStrategy.SPREADSHEET, null, List.of(), List.of(),
                        List.of("Extraction aborted, zero records"))));

        mockMvc.perform(multipart("/api/extractions/batch").file(first).file(second))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[1].filename").value("b.csv"))
                .andExpect(jsonPath("$.data[1].totalRecords").value(0));
    }

    @Test
    @SuppressWarnings("unchecked")
    void batch_emptyPartDoesNotRejectTheOthers() throws Exception {
        MockMultipartFile good = new MockMultipartFile("files", "a.pdf", "application/pdf", new byte[] { 1 });
        MockMultipartFile empty = new MockMultipartFile("files", "blank.pdf", "application/pdf", new byte[0]);
        when(extractionBatchService.extractAll(anyList())).thenReturn(List.of(
                hirayamaResult("a.pdf"),
                new ExtractionResult("blank.pdf", null, ExtractionStrategy.AI, null, List.of(), List.of(),
                        List.of("Empty document"))));

        mockMvc.perform(multipart("/api/extractions/batch").file(good).file(empty))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(2))
                .andExpect(jsonPath("$.data[0].totalRecords").value(1))
                .andExpect(jsonPath("$.data[1].trace[0]").value("Empty document"));

        ArgumentCaptor<List<DocumentUpload>> uploads = ArgumentCaptor.forClass(List.class);
        verify(extractionBatchService).extractAll(uploads.capture());
        assertEquals(2, uploads.getValue().size());
        assertEquals("blank.pdf", uploads.getValue().get(1).filename());
        assertEquals(0, uploads.getValue().get(1).content().length);
    }
}
