package com.shinmonzen.backend.services.invoices.vision;

import java.util.List;

import com.shinmonzen.backend.services.invoices.pdf.RenderedPage;

public class DisabledVisionModelClient implements VisionModelClient {

    private final String reason;

    public DisabledVisionModelClient(String reason) {
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String complete(String prompt, List<RenderedPage> pages) {
        throw new IllegalStateException("Vision model is disabled: " + reason);
    }
}
