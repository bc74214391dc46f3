package com.skillflow.composer.model;

/**
 * Overall status of one workflow execution.
 *
 * RUNNING is the placeholder written at creation; every execution ends
 * in COMPLETED or FAILED.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
