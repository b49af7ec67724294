package com.example.hydrant.model;

public record EnqueuedFile(
        String queueItemId,
        String fileReference) {
}
