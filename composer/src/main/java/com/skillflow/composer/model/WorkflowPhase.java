package com.skillflow.composer.model;

/**
 * Fine-grained lifecycle of a workflow run.
 *
 * Transitions:
 *   CREATED → VALIDATING → INVALID                     (terminal)
 *   CREATED → VALIDATING → RUNNING → COMPLETED         (terminal)
 *   RUNNING → FAILED → ROLLING_BACK → ROLLED_BACK      (terminal)
 */
public enum WorkflowPhase {
    CREATED,
    VALIDATING,
    INVALID,
    RUNNING,
    COMPLETED,
    FAILED,
    ROLLING_BACK,
    ROLLED_BACK
}
