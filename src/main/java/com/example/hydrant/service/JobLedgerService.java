package com.example.hydrant.service;

import com.example.hydrant.model.IdentityKey;
import com.example.hydrant.model.Job;
import com.example.hydrant.model.JobDocument;
import com.example.hydrant.model.JobStatus;
import com.example.hydrant.model.JobSummaryDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.elasticsearch.core.ElasticsearchOperations;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.UUID;

/**
 * Records each job's progress in Mongo and a searchable summary in Elasticsearch.
 * Ledger failures are logged and never fail the job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLedgerService {

    private final MongoTemplate mongoTemplate;
    private final ElasticsearchOperations elasticsearchOperations;
    private final Clock clock;

    public void recordReceived(Job job, String workerId) {
        JobDocument document = baseDocument(job)
                .workerId(workerId)
                .status(JobStatus.RECEIVED)
                .build();
        save(document, null);
    }

    public void recordCompleted(PipelineResult result, String workerId, String bundlePath) {
        JobDocument document = baseDocument(result.job())
                .workerId(workerId)
                .status(JobStatus.COMPLETED)
                .sourceKind(result.extraction().sourceKind())
                .bundleId(result.bundle().id())
                .bundlePath(bundlePath)
                .resourceCount(result.bundle().entries().size())
                .completedAt(clock.millis())
                .build();
        save(document, result.canonicalKeys());
    }

    /**
     * @param job null when the failure happened before the job could be built
     */
    public void recordFailed(Job job, String fileReference, String workerId, JobStatus status, String failure) {
        JobDocument.JobDocumentBuilder builder = job != null
                ? baseDocument(job)
                : JobDocument.builder()
                        .id(UUID.randomUUID().toString())
                        .createdAt(Date.from(clock.instant()))
                        .transactionTime(clock.millis())
                        .fileReference(fileReference);
        JobDocument document = builder
                .workerId(workerId)
                .status(status)
                .failure(failure)
                .completedAt(clock.millis())
                .build();
        save(document, null);
    }

    private JobDocument.JobDocumentBuilder baseDocument(Job job) {
        return JobDocument.builder()
                .id(job.transactionId())
                .createdAt(Date.from(job.transactionTime()))
                .transactionTime(job.transactionTime().toEpochMilli())
                .fileReference(job.fileReference())
                .contentFingerprint(job.contentFingerprint())
                .mime(job.mime())
                .classificationErrors(job.classificationErrors());
    }

    private void save(JobDocument document, List<IdentityKey> keys) {
        try {
            mongoTemplate.save(document);
            log.info("Saved {} job: {}", document.getStatus(), document.getId());
        } catch (Exception e) {
            log.error("Failed to save job document {}", document.getId(), e);
        }

        try {
            elasticsearchOperations.save(toSummary(document, keys));
        } catch (Exception e) {
            log.error("Failed to index job summary {}", document.getId(), e);
        }
    }

    private static JobSummaryDocument toSummary(JobDocument document, List<IdentityKey> keys) {
        return JobSummaryDocument.builder()
                .id(document.getId())
                .status(document.getStatus())
                .transactionTime(document.getTransactionTime())
                .fileReference(document.getFileReference())
                .contentFingerprint(document.getContentFingerprint())
                .mimeType(document.getMime() == null ? null
                        : document.getMime().type() + "/" + document.getMime().subtype())
                .sourceKind(document.getSourceKind())
                .bundleId(document.getBundleId())
                .resourceKeys(keys == null ? null : keys.stream().map(IdentityKey::toString).toList())
                .failure(document.getFailure())
                .build();
    }
}
