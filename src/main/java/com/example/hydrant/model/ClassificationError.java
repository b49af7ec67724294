package com.example.hydrant.model;

public record ClassificationError(
        Stage stage,
        String message,
        String details) {

    public enum Stage {
        FINGERPRINT,
        MIME
    }
}
