package com.example.hydrant.service;

import com.example.hydrant.model.ClassificationError;
import com.example.hydrant.model.Job;
import com.example.hydrant.model.MimeClassification;
import com.example.hydrant.tool.MimeTypeDetector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Builds the {@link Job} for a file reference: fingerprint plus MIME classification.
 * Failures of either step are recorded on the job instead of aborting it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ClassificationService {

    private final ContentFingerprinter fingerprinter;
    private final MimeTypeDetector mimeTypeDetector;
    private final Clock clock;

    public Job classify(String fileReference) {
        String transactionId = UUID.randomUUID().toString();
        List<ClassificationError> errors = new ArrayList<>();

        String fingerprint = null;
        try {
            fingerprint = fingerprinter.fingerprint(Path.of(fileReference));
        } catch (Exception e) {
            log.warn("Failed to compute {} hash for {} (transaction {}): {}",
                    fingerprinter.getAlgorithm(), fileReference, transactionId, e.getMessage());
            errors.add(new ClassificationError(ClassificationError.Stage.FINGERPRINT,
                    "Failed to compute " + fingerprinter.getAlgorithm() + " hash", e.toString()));
        }

        MimeClassification mime = null;
        try {
            mime = mimeTypeDetector.detect(Path.of(fileReference));
        } catch (Exception e) {
            log.warn("Failed to determine MIME type for {} (transaction {}): {}",
                    fileReference, transactionId, e.getMessage());
            errors.add(new ClassificationError(ClassificationError.Stage.MIME,
                    "Failed to determine MIME type", e.toString()));
        }

        Job job = new Job(transactionId, clock.instant(), fileReference, fingerprint, mime, errors);
        log.info("Classified {} as {} (transaction {}, {} error(s))",
                fileReference, mime, transactionId, errors.size());
        return job;
    }
}
