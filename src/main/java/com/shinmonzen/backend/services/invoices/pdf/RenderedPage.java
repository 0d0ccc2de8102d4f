package com.shinmonzen.backend.services.invoices.pdf;

/**
 * One page rendered to PNG, ready for the vision model.
 */
public record RenderedPage(int pageIndex, byte[] png) {

    public RenderedPage {
        png = png == null ? new byte[0] : png;
    }
}
