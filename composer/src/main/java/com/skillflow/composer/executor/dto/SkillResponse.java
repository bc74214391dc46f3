package com.skillflow.composer.executor.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Response from POST /skills/{skill_id}/execute.
 *
 * result is opaque to the engine except when it is a JSON object: then its
 * keys are merged into the inputs of dependent steps and can be read by
 * conditions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillResponse(
        boolean success,
        Object  result,
        String  error) {

    public static SkillResponse ok(Object result) {
        return new SkillResponse(true, result, null);
    }

    public static SkillResponse failed(String error) {
        return new SkillResponse(false, null, error);
    }
}
