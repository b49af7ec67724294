package com.example.hydrant.model;

public record BundleCreatedEvent(
        String transactionId,
        String bundleId,
        String objectPath,
        int entryCount,
        String fileReference) {
}
