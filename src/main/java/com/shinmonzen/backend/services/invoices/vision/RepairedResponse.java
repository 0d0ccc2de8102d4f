package com.shinmonzen.backend.services.invoices.vision;

public record RepairedResponse(RepairStage stage, VisionDocument document) {
}
