package com.skillflow.composer.engine;

import com.skillflow.composer.graph.ValidationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * What executeWorkflow hands back to the caller.
 *
 * On failure, results still holds the outputs of the steps that completed
 * before the failing one, so the caller can audit what ran.
 *
 * @param executionId     Id of the persisted WorkflowExecutionRecord.
 * @param results         step_id → output, in completion order. Skipped steps are absent.
 * @param rolledBack      True when rollback was invoked.
 * @param durationSeconds Wall-clock time of the whole run.
 * @param error           Null on success.
 * @param failureType     Null on success.
 * @param failedStepId    Step that failed; null on success and on validation failure.
 * @param skippedSteps    Steps whose condition was false or could not be evaluated.
 */
public record ExecutionResult(
        UUID                executionId,
        String              workflowId,
        boolean             success,
        Map<String, Object> results,
        boolean             rolledBack,
        double              durationSeconds,
        String              error,
        FailureType         failureType,
        String              failedStepId,
        List<String>        skippedSteps,
        ValidationResult    validation) {

    public ExecutionResult {
        // Step outputs may be null, so no Map.copyOf here.
        results      = results == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(results));
        skippedSteps = skippedSteps == null ? List.of() : List.copyOf(skippedSteps);
    }
}
