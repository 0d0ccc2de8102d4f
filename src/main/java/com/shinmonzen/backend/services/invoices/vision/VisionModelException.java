package com.shinmonzen.backend.services.invoices.vision;

public class VisionModelException extends RuntimeException {

    public VisionModelException(String message) {
        super(message);
    }

    public VisionModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
