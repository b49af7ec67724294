package com.example.hydrant.model;

public record BundleEntry(
        String fullUrl,
        Resource resource) {
}
