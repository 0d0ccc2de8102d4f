package com.shinmonzen.backend.services.invoices.vision;

import java.util.List;

import com.shinmonzen.backend.services.invoices.pdf.RenderedPage;

public interface VisionModelClient {

    /**
     * False when no credential is configured; callers then skip the call entirely.
     */
    boolean isAvailable();

    /**
     * Single blocking request, never retried. Returns the raw text of the first choice.
     *
     * @throws VisionModelException on transport errors, timeouts or an empty completion
     */
    String complete(String prompt, List<RenderedPage> pages);
}
