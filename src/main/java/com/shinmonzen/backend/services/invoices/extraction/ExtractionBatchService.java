package com.shinmonzen.backend.services.invoices.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs independent extraction sessions on the bounded extraction executor. Results keep the
 * order of the input; one failing document never affects the others.
 */
@Service
@Slf4j
public class ExtractionBatchService {

    private final ExtractionPipeline pipeline;
    private final Executor executor;

    public ExtractionBatchService(ExtractionPipeline pipeline, @Qualifier("extractionTaskExecutor") Executor executor) {
        this.pipeline = pipeline;
        this.executor = executor;
    }

    public List<ExtractionResult> extractAll(List<DocumentUpload> documents) {
        if (documents == null || documents.isEmpty()) return List.of();

        long start = System.currentTimeMillis();
        List<CompletableFuture<ExtractionResult>> futures = new ArrayList<>();
        for (DocumentUpload document : documents) {
            CompletableFuture<ExtractionResult> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> pipeline.extract(document.filename(), document.content()), executor)
                        .exceptionally(e -> failed(document, e));
            } catch (RuntimeException e) {
                // executor saturated
                future = CompletableFuture.completedFuture(failed(document, e));
            }
            futures.add(future);
        }

        List<ExtractionResult> results = new ArrayList<>(futures.size());
        for (CompletableFuture<ExtractionResult> future : futures) {
            results.add(future.join());
        }

        log.info("[Extraction] Batch finished: documents={} records={} elapsedMs={}",
                results.size(),
                results.stream().mapToInt(r -> r.records().size()).sum(),
                System.currentTimeMillis() - start);
        return results;
    }

    private static ExtractionResult failed(DocumentUpload document, Throwable e) {
        log.warn("[Extraction] Document '{}' could not be scheduled: {}", document.filename(), e.toString());
        return new ExtractionResult(document.filename(), null, null, null, List.of(), List.of(),
                List.of("Extraction not run: " + e.getMessage()));
    }
}
