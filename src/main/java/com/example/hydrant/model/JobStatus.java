package com.example.hydrant.model;

public enum JobStatus {
    RECEIVED,
    COMPLETED,
    FAILED,
    DEAD_LETTERED
}
