package com.example.hydrant.model;

public enum SourceKind {
    TEXT_LAYER,
    OCR
}
