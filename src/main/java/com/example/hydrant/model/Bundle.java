package com.example.hydrant.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Terminal artifact of a job. The timestamp is kept as its ISO-8601 UTC string.
 */
@JsonPropertyOrder({"resourceType", "id", "type", "timestamp", "entry"})
public record Bundle(
        String id,
        String type,
        String timestamp,
        @JsonProperty("entry") List<BundleEntry> entries) {

    public static final String RESOURCE_TYPE = "Bundle";

    public Bundle {
        entries = List.copyOf(entries);
    }

    @JsonProperty("resourceType")
    public String resourceType() {
        return RESOURCE_TYPE;
    }
}
