package com.skillflow.composer.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads workflow definitions from JSON.
 *
 * Only syntax is checked here. Graph problems (cycles, unknown
 * dependencies, duplicate ids) are left to the validator so they are
 * reported the same way for every caller.
 */
@Component
public class WorkflowDefinitionLoader {

    private final ObjectMapper json;

    public WorkflowDefinitionLoader(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public WorkflowDefinition load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new WorkflowDefinitionException("Workflow definition not found: " + file);
        }
        try {
            return parse(Files.readString(file));
        } catch (IOException e) {
            throw new WorkflowDefinitionException("Could not read workflow definition " + file, e);
        }
    }

    public WorkflowDefinition parse(String content) {
        WorkflowDefinition definition;
        try {
            definition = json.readValue(content, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new WorkflowDefinitionException("Malformed workflow definition: " + e.getOriginalMessage(), e);
        }
        if (definition == null || definition.workflowId() == null || definition.workflowId().isBlank()) {
            throw new WorkflowDefinitionException("Workflow definition has no workflow_id");
        }
        return definition;
    }
}
