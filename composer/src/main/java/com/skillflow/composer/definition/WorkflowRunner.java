package com.skillflow.composer.definition;

import com.skillflow.composer.engine.ExecutionResult;
import com.skillflow.composer.engine.SkillCompositionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs one workflow definition file at startup.
 *
 * Enabled by setting composer.run.workflow-file, e.g.
 *   java -jar composer.jar --composer.run.workflow-file=workflows/report.json
 *
 * Without it the runner does nothing and the engine is only reachable
 * as a bean.
 */
@Component
public class WorkflowRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunner.class);

    private final WorkflowDefinitionLoader loader;
    private final SkillCompositionEngine   engine;
    private final String                   workflowFile;

    public WorkflowRunner(WorkflowDefinitionLoader loader,
                          SkillCompositionEngine engine,
                          @Value("${composer.run.workflow-file:}") String workflowFile) {
        this.loader       = loader;
        this.engine       = engine;
        this.workflowFile = workflowFile;
    }

    @Override
    public void run(String... args) {
        if (workflowFile == null || workflowFile.isBlank()) {
            log.info("No composer.run.workflow-file configured, nothing to run");
            return;
        }

        WorkflowDefinition definition = loader.load(Path.of(workflowFile));
        log.info("Running workflow '{}' from {}", definition.workflowId(), workflowFile);

        ExecutionResult result = engine.executeWorkflow(
                definition.workflowId(), definition.steps(), definition.agentId());

        if (result.success()) {
            log.info("Workflow '{}' succeeded in {}s: {} step results, skipped={}",
                    result.workflowId(), result.durationSeconds(),
                    result.results().size(), result.skippedSteps());
        } else {
            log.error("Workflow '{}' failed ({}): {} [rolledBack={}, execution={}]",
                    result.workflowId(), result.failureType(), result.error(),
                    result.rolledBack(), result.executionId());
        }
    }
}
