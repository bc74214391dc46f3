package com.skillflow.composer.model;

/**
 * Outcome of workflow validation, recorded once per execution.
 */
public enum ValidationStatus {
    VALID,
    INVALID
}
