package com.skillflow.composer.executor.dto;

import java.util.Map;

/**
 * Request body for POST /skills/{skill_id}/execute.
 * Field names match the executor's snake_case JSON.
 */
public record ExecuteSkillRequest(
        Map<String, Object> inputs,
        String agent_id) {}
