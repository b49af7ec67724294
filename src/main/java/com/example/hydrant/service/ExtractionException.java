package com.example.hydrant.service;

/**
 * Fatal for the job: an extraction tool failed. Not retried.
 */
public class ExtractionException extends RuntimeException {

    private final String transactionId;
    private final ExtractionState failedIn;

    public ExtractionException(String transactionId, ExtractionState failedIn, String message, Throwable cause) {
        super("Extraction failed in " + failedIn + " for transaction " + transactionId + ": " + message, cause);
        this.transactionId = transactionId;
        this.failedIn = failedIn;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public ExtractionState getFailedIn() {
        return failedIn;
    }
}
