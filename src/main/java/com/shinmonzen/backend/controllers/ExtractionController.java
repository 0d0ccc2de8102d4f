package com.shinmonzen.backend.controllers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.shinmonzen.backend.dto.ApiResponse;
import com.shinmonzen.backend.dto.ExtractionResponseDTO;
import com.shinmonzen.backend.exceptions.BadRequestException;
import com.shinmonzen.backend.services.invoices.extraction.DocumentUpload;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionBatchService;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionPipeline;
import com.shinmonzen.backend.services.invoices.extraction.ExtractionResult;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Invoice upload. A document that cannot be parsed is still a 200 with zero records and a trace;
 * only a missing or empty single upload is rejected. Inside a batch an empty part is extracted like
 * any other document and comes back with an "Empty document" trace.
 */
@RestController
@RequestMapping("/api/extractions")
@RequiredArgsConstructor
@Slf4j
public class ExtractionController {

    private final ExtractionPipeline extractionPipeline;
    private final ExtractionBatchService extractionBatchService;

    @PostMapping
    public ResponseEntity<ApiResponse<ExtractionResponseDTO>> extract(@RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("File missing or empty");
        }
        DocumentUpload upload = toUpload(file);
        log.info("[InvoiceUpload] file='{}' bytes={}", upload.filename(), upload.content().length);

        ExtractionResult result = extractionPipeline.extract(upload.filename(), upload.content());
        return ResponseEntity.ok(ApiResponse.success(ExtractionResponseDTO.from(result),
                result.records().size() + " records extracted"));
    }

    @PostMapping("/batch")
    public ResponseEntity<ApiResponse<List<ExtractionResponseDTO>>> extractBatch(@RequestParam("files") List<MultipartFile> files) {
        if (files == null || files.isEmpty()) {
            throw new BadRequestException("No files uploaded");
        }

        List<DocumentUpload> uploads = new ArrayList<>();
        for (MultipartFile file : files) {
            if (file == null) continue;
            uploads.add(toUpload(file));
        }
        log.info("[InvoiceUpload] batch of {} files", uploads.size());

        List<ExtractionResponseDTO> payload = extractionBatchService.extractAll(uploads).stream()
                .map(ExtractionResponseDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(payload, payload.size() + " documents processed"));
    }

    private static DocumentUpload toUpload(MultipartFile file) {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "upload";
        try {
            return new DocumentUpload(filename, file.getBytes());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read upload '" + filename + "'", e);
        }
    }
}
