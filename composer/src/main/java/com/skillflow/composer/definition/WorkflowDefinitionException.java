package com.skillflow.composer.definition;

/**
 * Thrown when a workflow definition file is missing, unreadable or not valid JSON.
 */
public class WorkflowDefinitionException extends RuntimeException {

    public WorkflowDefinitionException(String message) {
        super(message);
    }

    public WorkflowDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
