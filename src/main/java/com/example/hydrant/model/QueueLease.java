package com.example.hydrant.model;

/**
 * A worker's time-limited claim on one queue item. Must be acked or nacked.
 */
public record QueueLease(
        String itemId,
        String fileReference,
        String leaseHolder,
        int deliveryCount) {
}
