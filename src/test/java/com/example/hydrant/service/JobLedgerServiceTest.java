package com.example.hydrant.service;

import com.example.hydrant.model.Bundle;
import com.example.hydrant.model.BundleEntry;
import com.example.hydrant.model.ExtractionResult;
import com.example.hydrant.model.IdentityKey;
import com.example.hydrant.model.Job;
import com.example.hydrant.model.JobDocument;
import com.example.hydrant.model.JobStatus;
import com.example.hydrant.model.JobSummaryDocument;
import com.example.hydrant.model.MimeClassification;
import com.example.hydrant.model.Resource;
import com.example.hydrant.model.SourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.elasticsearch.core.ElasticsearchOperations;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class JobLedgerServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:10Z");

    @Mock
    private MongoTemplate mongoTemplate;

    @Mock
    private ElasticsearchOperations elasticsearchOperations;

    private JobLedgerService ledger;

    private final Job job = new Job("tx-1", Instant.parse("2024-05-01T10:00:00Z"), "/data/in/report.pdf", "abc123",
            new MimeClassification("application", "pdf", "binary"), List.of());

    @BeforeEach
    void setUp() {
        ledger = new JobLedgerService(mongoTemplate, elasticsearchOperations, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void recordCompleted_SavesDocumentAndSummary() {
        // Arrange
        Bundle bundle = new Bundle("bundle-1", "collection", "2024-05-01T10:00:09Z",
                List.of(new BundleEntry("urn:uuid:e1", new Resource("Patient", "12345"))));
        PipelineResult result = new PipelineResult(job,
                new ExtractionResult(SourceKind.OCR, "<html/>", "tx-1", Path.of("out/tx-1.hocr")),
                2, List.of(new IdentityKey("Patient", "12345")), bundle);

        // Act
        ledger.recordCompleted(result, "worker-0", "24/05/01/bundle-1.json");

        // Assert
        ArgumentCaptor<JobDocument> document = ArgumentCaptor.forClass(JobDocument.class);
        verify(mongoTemplate).save(document.capture());
        assertEquals("tx-1", document.getValue().getId());
        assertEquals(JobStatus.COMPLETED, document.getValue().getStatus());
        assertEquals(SourceKind.OCR, document.getValue().getSourceKind());
        assertEquals("24/05/01/bundle-1.json", document.getValue().getBundlePath());
        assertEquals(1, document.getValue().getResourceCount());
        assertEquals(NOW.toEpochMilli(), document.getValue().getCompletedAt());

        ArgumentCaptor<JobSummaryDocument> summary = ArgumentCaptor.forClass(JobSummaryDocument.class);
        verify(elasticsearchOperations).save(summary.capture());
        assertEquals("application/pdf", summary.getValue().getMimeType());
        assertEquals(List.of("Patient/12345"), summary.getValue().getResourceKeys());
    }

    @Test
    void recordFailed_WithoutJobUsesFileReference() {
        ledger.recordFailed(null, "/data/in/missing.pdf", "worker-1", JobStatus.DEAD_LETTERED, "boom");

        ArgumentCaptor<JobDocument> document = ArgumentCaptor.forClass(JobDocument.class);
        verify(mongoTemplate).save(document.capture());
        assertNotNull(document.getValue().getId());
        assertEquals("/data/in/missing.pdf", document.getValue().getFileReference());
        assertEquals(JobStatus.DEAD_LETTERED, document.getValue().getStatus());
        assertEquals("boom", document.getValue().getFailure());
    }

    @Test
    void storeFailuresDoNotPropagate() {
        when(mongoTemplate.save(any(JobDocument.class))).thenThrow(new RuntimeException("Mongo down"));
        when(elasticsearchOperations.save(any(JobSummaryDocument.class))).thenThrow(new RuntimeException("ES down"));

        assertDoesNotThrow(() -> ledger.recordReceived(job, "worker-0"));
    }
}
