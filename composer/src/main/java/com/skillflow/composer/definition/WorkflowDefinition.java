package com.skillflow.composer.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.skillflow.composer.model.WorkflowStep;

import java.util.List;

/**
 * A workflow as written in a JSON definition file.
 *
 * Example:
 * <pre>
 * {
 *   "workflow_id": "weekly-report",
 *   "agent_id": "agent-7",
 *   "steps": [
 *     {"step_id": "fetch", "skill_id": "crm.fetch_deals", "inputs": {"days": 7}},
 *     {"step_id": "mail",  "skill_id": "mail.send", "dependencies": ["fetch"],
 *      "condition": "fetch.get('count') > 0"}
 *   ]
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowDefinition(
        @JsonProperty("workflow_id") String             workflowId,
        @JsonProperty("agent_id")    String             agentId,
        @JsonProperty("steps")       List<WorkflowStep> steps) {

    public WorkflowDefinition {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
