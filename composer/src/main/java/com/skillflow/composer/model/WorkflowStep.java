package com.skillflow.composer.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * One node of a workflow: a single skill invocation plus its wiring.
 *
 * dependencies is an ordered sequence. The order matters because the
 * input resolver merges dependency outputs in exactly this order
 * (last write wins), so duplicates are collapsed keeping the first one.
 *
 * @param stepId         Unique within the workflow; used for dependency references
 *                       and as the key of the step's result.
 * @param skillId        Which external skill the backend should run.
 * @param inputs         Static inputs supplied when the workflow was built.
 * @param dependencies   Steps that must complete before this one runs.
 * @param condition      Optional predicate over prior results; null means "always run".
 * @param timeoutSeconds Optional execution budget; null falls back to the configured default.
 * @param compensation   Optional compensating action run during rollback.
 */
public record WorkflowStep(
        @JsonProperty("step_id")         String             stepId,
        @JsonProperty("skill_id")        String             skillId,
        @JsonProperty("inputs")          Map<String, Object> inputs,
        @JsonProperty("dependencies")    List<String>       dependencies,
        @JsonProperty("condition")       String             condition,
        @JsonProperty("timeout_seconds") Integer            timeoutSeconds,
        @JsonProperty("compensation")    Compensation       compensation) {

    public WorkflowStep {
        // LinkedHashMap rather than Map.copyOf: skill inputs may legitimately hold nulls.
        inputs = inputs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        dependencies = dependencies == null
                ? List.of()
                : List.copyOf(new LinkedHashSet<>(dependencies));
        if (condition != null && condition.isBlank()) condition = null;
    }

    /** Step with no condition, default timeout and no compensation. */
    public static WorkflowStep of(String stepId, String skillId,
                                  Map<String, Object> inputs, String... dependencies) {
        return new WorkflowStep(stepId, skillId, inputs,
                List.of(dependencies), null, null, null);
    }

    public boolean hasCondition()    { return condition != null; }
    public boolean hasCompensation() { return compensation != null; }

    public WorkflowStep withCondition(String newCondition) {
        return new WorkflowStep(stepId, skillId, inputs, dependencies, newCondition, timeoutSeconds, compensation);
    }

    public WorkflowStep withTimeoutSeconds(Integer newTimeout) {
        return new WorkflowStep(stepId, skillId, inputs, dependencies, condition, newTimeout, compensation);
    }

    public WorkflowStep withCompensation(Compensation newCompensation) {
        return new WorkflowStep(stepId, skillId, inputs, dependencies, condition, timeoutSeconds, newCompensation);
    }
}
