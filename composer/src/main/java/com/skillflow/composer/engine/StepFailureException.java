package com.skillflow.composer.engine;

/**
 * Thrown when a single step cannot complete: the backend reported failure
 * or the call timed out.
 *
 * Never crosses the engine boundary. SkillCompositionEngine catches it,
 * rolls back and reports it through ExecutionResult.
 */
public class StepFailureException extends RuntimeException {

    private final FailureType type;
    private final String      stepId;

    public StepFailureException(FailureType type, String stepId, String message) {
        super("[" + type + "] step '" + stepId + "': " + message);
        this.type   = type;
        this.stepId = stepId;
    }

    public StepFailureException(FailureType type, String stepId, String message, Throwable cause) {
        super("[" + type + "] step '" + stepId + "': " + message, cause);
        this.type   = type;
        this.stepId = stepId;
    }

    public FailureType getType()   { return type; }
    public String      getStepId() { return stepId; }
}
