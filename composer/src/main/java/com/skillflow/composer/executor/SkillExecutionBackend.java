package com.skillflow.composer.executor;

import com.skillflow.composer.executor.dto.SkillResponse;

import java.util.Map;

/**
 * The service that actually runs skill code, possibly in a sandbox.
 *
 * The engine treats a call as an opaque, blocking operation. Implementations
 * must be safe to call from several workflow runs at once.
 */
public interface SkillExecutionBackend {

    /**
     * Run one skill.
     *
     * @throws SkillBackendException if the backend cannot be reached or answers with an error status
     */
    SkillResponse execute(String skillId, Map<String, Object> inputs, String agentId);
}
