package com.example.hydrant.model;

import java.time.Instant;
import java.util.List;

/**
 * One file's passage through the pipeline. Created once per queue pop.
 */
public record Job(
        String transactionId,
        Instant transactionTime,
        String fileReference,
        String contentFingerprint, // null when hashing failed
        MimeClassification mime, // null when the sniffing tool failed
        List<ClassificationError> classificationErrors) {

    public Job {
        classificationErrors = classificationErrors == null ? List.of() : List.copyOf(classificationErrors);
    }

    public boolean hasClassificationErrors() {
        return !classificationErrors.isEmpty();
    }
}
