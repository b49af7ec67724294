package com.example.hydrant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.Date;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "jobs")
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobDocument {

    @Id
    private String id; // transactionId

    private String workerId;

    private JobStatus status;

    // Field for automatic expiration (TTL)
    // 604800 seconds = 7 days
    @Indexed(name = "ttl_index", expireAfterSeconds = 604800)
    private Date createdAt;

    private long transactionTime;

    private String fileReference;

    @Indexed
    private String contentFingerprint;

    private MimeClassification mime;

    private List<ClassificationError> classificationErrors;

    private SourceKind sourceKind;

    private String bundleId;

    private String bundlePath;

    private int resourceCount;

    private String failure;

    private long completedAt;
}
