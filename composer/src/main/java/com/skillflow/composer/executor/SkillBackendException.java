package com.skillflow.composer.executor;

/**
 * Thrown when the skill execution backend returns an error status or is unreachable.
 *
 * A well-formed response with success=false is not an exception; it comes
 * back as a normal {@link com.skillflow.composer.executor.dto.SkillResponse}.
 */
public class SkillBackendException extends RuntimeException {

    public SkillBackendException(String message) {
        super(message);
    }

    public SkillBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
