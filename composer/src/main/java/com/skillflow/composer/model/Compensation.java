package com.skillflow.composer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Compensating action registered by a step (saga pattern).
 *
 * There is no generic "inverse skill": a step that wants to be undone on
 * rollback names the skill that undoes it. Steps without one are skipped
 * during rollback.
 *
 * @param skillId Skill invoked to compensate the forward step.
 * @param inputs  Static inputs for the compensating call.
 */
public record Compensation(
        @JsonProperty("skill_id") String              skillId,
        @JsonProperty("inputs")   Map<String, Object> inputs) {

    public Compensation {
        inputs = inputs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }
}
