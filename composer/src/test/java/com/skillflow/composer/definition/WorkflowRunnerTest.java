package com.skillflow.composer.definition;

import com.skillflow.composer.engine.ExecutionResult;
import com.skillflow.composer.engine.SkillCompositionEngine;
import com.skillflow.composer.model.WorkflowStep;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowRunnerTest {

    @Mock WorkflowDefinitionLoader loader;
    @Mock SkillCompositionEngine   engine;

    @Test
    void run_noFileConfigured_doesNothing() {
        new WorkflowRunner(loader, engine, "").run();

        verifyNoInteractions(loader, engine);
    }

    @Test
    void run_fileConfigured_executesDefinition() {
        List<WorkflowStep> steps = List.of(WorkflowStep.of("s", "echo", Map.of()));
        when(loader.load(Path.of("wf.json")))
                .thenReturn(new WorkflowDefinition("nightly", "agent-3", steps));
        when(engine.executeWorkflow("nightly", steps, "agent-3"))
                .thenReturn(new ExecutionResult(UUID.randomUUID(), "nightly", true, Map.of(), false,
                        0.1, null, null, null, List.of(), null));

        new WorkflowRunner(loader, engine, "wf.json").run();

        verify(engine).executeWorkflow("nightly", steps, "agent-3");
    }

    @Test
    void run_badDefinition_failsStartup() {
        when(loader.load(any())).thenThrow(new WorkflowDefinitionException("Workflow definition not found: x"));

        assertThatThrownBy(() -> new WorkflowRunner(loader, engine, "x").run())
                .isInstanceOf(WorkflowDefinitionException.class);
        verifyNoInteractions(engine);
    }
}
