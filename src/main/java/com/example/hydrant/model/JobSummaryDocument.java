package com.example.hydrant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.elasticsearch.annotations.Document;
import org.springframework.data.elasticsearch.annotations.Field;
import org.springframework.data.elasticsearch.annotations.FieldType;

import java.util.List;

@Data
@Builder
@Document(indexName = "hydrant-jobs-#{T(java.time.LocalDate).now().toString()}", createIndex = false)
// createIndex = false: indices come from the hydrant-jobs index template (see JobSummaryIndexConfig)
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobSummaryDocument {

    @Id
    private String id; // transactionId

    @Field(type = FieldType.Keyword)
    private JobStatus status;

    @Field(type = FieldType.Long)
    private long transactionTime;

    @Field(type = FieldType.Keyword)
    private String fileReference;

    @Field(type = FieldType.Keyword)
    private String contentFingerprint;

    @Field(type = FieldType.Keyword)
    private String mimeType;

    @Field(type = FieldType.Keyword)
    private SourceKind sourceKind;

    @Field(type = FieldType.Keyword)
    private String bundleId;

    @Field(type = FieldType.Keyword)
    private List<String> resourceKeys;

    @Field(type = FieldType.Text)
    private String failure;
}
