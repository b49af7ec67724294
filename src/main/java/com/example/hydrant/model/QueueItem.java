package com.example.hydrant.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "file_queue")
@CompoundIndex(name = "status_available_enqueued", def = "{'status': 1, 'availableAt': 1, 'enqueuedAt': 1}")
public class QueueItem {

    public static final String PENDING = "PENDING";
    public static final String IN_FLIGHT = "IN_FLIGHT";

    @Id
    private String id;

    /**
     * File path or file reference pushed by the producer.
     */
    private String fileReference;

    private String status; // PENDING, IN_FLIGHT

    private long enqueuedAt;

    // Not handed out before this time; pushed forward on nack
    private long availableAt;

    private String leaseHolder;

    private long leaseExpiresAt;

    private int deliveryCount;
}
