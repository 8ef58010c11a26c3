package com.example.autoslides_backend.util;

/**
 * Overall status of a deck generation run.
 */
public enum PipelineStatus {
    SUCCESS,
    PARTIAL_SUCCESS,
    FAILURE
}
