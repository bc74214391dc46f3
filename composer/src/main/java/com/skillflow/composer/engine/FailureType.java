package com.skillflow.composer.engine;

/**
 * Why a workflow run did not succeed.
 *
 * VALIDATION never triggers rollback (nothing ran). The other two fail
 * the step they occurred in and roll back the steps completed before it.
 */
public enum FailureType {
    VALIDATION,
    STEP_EXECUTION,
    STEP_TIMEOUT
}
