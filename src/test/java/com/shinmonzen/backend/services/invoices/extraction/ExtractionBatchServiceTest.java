package com.shinmonzen.backend.services.invoices.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.junit.jupiter.api.Test;

import com.shinmonzen.backend.services.invoices.detection.ExtractionStrategy;

class ExtractionBatchServiceTest {

    private static ExtractionResult resultFor(String filename) {
        return new ExtractionResult(filename, "Minato", ExtractionStrategy.AI, false, List.of(), List.of(), List.of("ok"));
    }

    @Test
    void resultsKeepInputOrderAndFailuresStayIsolated() {
        ExtractionPipeline pipeline = org.mockito.Mockito.mock(ExtractionPipeline.class);
        when(pipeline.extract(eq("a.pdf"), any())).thenReturn(resultFor("a.pdf"));
        when(pipeline.extract(eq("b.pdf"), any())).thenThrow(new IllegalStateException("boom"));
        when(pipeline.extract(eq("c.pdf"), any())).thenReturn(resultFor("c.pdf"));

        Executor direct = Runnable::run;
        ExtractionBatchService service = new ExtractionBatchService(pipeline, direct);

        List<ExtractionResult> results = service.extractAll(List.of(
                new DocumentUpload("a.pdf", new byte[] { 1 }),
                new DocumentUpload("b.pdf", new byte[] { 2 }),
                new DocumentUpload("c.pdf", new byte[] { 3 })));

        assertEquals(3, results.size());
        assertEquals("a.pdf", results.get(0).filename());
        assertEquals("b.pdf", results.get(1).filename());
        assertEquals("c.pdf", results.get(2).filename());
        assertTrue(results.get(1).records().isEmpty());
        assertTrue(results.get(1).trace().get(0).startsWith("Extraction not run"));
        assertEquals("ok", results.get(2).trace().get(0));
    }

    @Test
    void saturatedExecutorYieldsFailedResults() {
        ExtractionPipeline pipeline = org.mockito.Mockito.mock(ExtractionPipeline.class);
        Executor saturated = command -> {
            throw new RejectedExecutionException("queue full");
        };
        ExtractionBatchService service = new ExtractionBatchService(pipeline, saturated);

        List<ExtractionResult> results = service.extractAll(List.of(new DocumentUpload("a.pdf", new byte[] { 1 })));

        assertEquals(1, results.size());
        assertTrue(results.get(0).trace().get(0).contains("queue full"));
    }

    @Test
    void emptyBatch() {
        ExtractionBatchService service = new ExtractionBatchService(org.mockito.Mockito.mock(ExtractionPipeline.class), Runnable::run);

        assertTrue(service.extractAll(List.of()).isEmpty());
    }
}
