package com.shinmonzen.backend.controllers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.shinmonzen.backend.dto.ApiResponse;
import com.shinmonzen.backend.dto.SalesRecordDTO;
import com.shinmonzen.backend.exceptions.BadRequestException;
import com.shinmonzen.backend.services.sales.SalesReportExtractor;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/sales")
@RequiredArgsConstructor
public class SalesReportController {

    private final SalesReportExtractor salesReportExtractor;

    @PostMapping("/upload")
    public ResponseEntity<ApiResponse<List<SalesRecordDTO>>> upload(@RequestParam("file") MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new BadRequestException("File missing or empty");
        }

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read upload", e);
        }

        List<SalesRecordDTO> rows = salesReportExtractor.extract(content).stream()
                .map(SalesRecordDTO::from)
                .toList();
        return ResponseEntity.ok(ApiResponse.success(rows, rows.size() + " sales rows parsed"));
    }
}
