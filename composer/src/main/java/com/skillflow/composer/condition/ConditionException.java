package com.skillflow.composer.condition;

/**
 * Thrown when a step condition cannot be parsed or evaluated.
 *
 * Unchecked, like the other engine exceptions. The orchestrator catches it
 * at the step boundary, logs it and skips the step.
 */
public class ConditionException extends RuntimeException {

    public ConditionException(String condition, String message) {
        super(message + " in condition: " + condition);
    }
}
