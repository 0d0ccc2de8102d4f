package com.shinmonzen.backend.services.invoices.vision;

public enum RepairStage {
    /** Whole response parsed as JSON after stripping code fences. */
    DIRECT,
    /** Header fields and complete item objects recovered one by one. */
    OBJECT_SCAN,
    /** Cut at the last complete item and closed with "]}". */
    BRACKET_CLOSURE
}
