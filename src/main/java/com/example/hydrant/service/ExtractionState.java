package com.example.hydrant.service;

public enum ExtractionState {
    START,
    TRY_TEXT_LAYER,
    EXTRACTED_TEXT,
    RASTERIZE,
    OCR,
    EXTRACTED_MARKUP,
    FAILED
}
