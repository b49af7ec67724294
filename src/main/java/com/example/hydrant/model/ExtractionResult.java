package com.example.hydrant.model;

import java.nio.file.Path;

public record ExtractionResult(
        SourceKind sourceKind,
        String payload, // plain text or hOCR markup
        String transactionId,
        Path outputPath) {
}
