package com.skillflow.composer.engine;

import com.skillflow.composer.condition.ConditionEvaluator;
import com.skillflow.composer.condition.ConditionException;
import com.skillflow.composer.graph.ValidationResult;
import com.skillflow.composer.graph.WorkflowValidator;
import com.skillflow.composer.model.*;
import com.skillflow.composer.store.ExecutionRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point of the engine: validates a workflow and runs it.
 *
 * A run goes through:
 *  1. Create the execution record (status RUNNING, phase CREATED).
 *  2. Validate. Invalid workflows stop here: nothing runs, nothing is rolled back.
 *  3. Walk the execution order one step at a time:
 *       condition false or unevaluable → skip (no backend call, no result)
 *       otherwise       → resolve inputs, call the skill, store its output
 *  4. On the first failing step: stop, roll back the completed steps,
 *     mark the run FAILED.
 *  5. Otherwise mark the run COMPLETED.
 *
 * Steps run strictly one after another, so the results map needs no locking.
 * Concurrent calls share nothing mutable: each run owns its results map and
 * its record.
 *
 * Errors never escape executeWorkflow; callers inspect
 * {@link ExecutionResult#success()} and {@link ExecutionResult#error()}.
 */
@Service
public class SkillCompositionEngine {

    private static final Logger log = LoggerFactory.getLogger(SkillCompositionEngine.class);

    private final WorkflowValidator    validator;
    private final InputResolver        inputResolver;
    private final ConditionEvaluator   conditionEvaluator;
    private final StepInvoker          stepInvoker;
    private final RollbackManager      rollbackManager;
    private final ExecutionRecordStore recordStore;
    private final MeterRegistry        meterRegistry;
    private final Clock                clock;

    public SkillCompositionEngine(WorkflowValidator validator,
                                  InputResolver inputResolver,
                                  ConditionEvaluator conditionEvaluator,
                                  StepInvoker stepInvoker,
                                  RollbackManager rollbackManager,
                                  ExecutionRecordStore recordStore,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.validator          = validator;
        this.inputResolver      = inputResolver;
        this.conditionEvaluator = conditionEvaluator;
        this.stepInvoker        = stepInvoker;
        this.rollbackManager    = rollbackManager;
        this.recordStore        = recordStore;
        this.meterRegistry      = meterRegistry;
        this.clock              = clock;
    }

    // ------------------------------------------------------------------
    // Public API
    // ------------------------------------------------------------------

    /** Check a step list without running it. No side effects. */
    public ValidationResult validateWorkflow(List<WorkflowStep> steps) {
        return validator.validate(steps);
    }

    /**
     * Validate and run a workflow.
     *
     * @param workflowId caller's identifier; re-running the same id creates a new record
     * @param agentId    forwarded to every skill call
     */
    public ExecutionResult executeWorkflow(String workflowId, List<WorkflowStep> steps, String agentId) {
        List<WorkflowStep> stepList = steps == null ? List.of() : steps;
        WorkflowExecutionRecord record =
                new WorkflowExecutionRecord(workflowId, agentId, stepList.size(), clock.instant());

        MDC.put("workflowId",  String.valueOf(workflowId));
        MDC.put("executionId", record.getId().toString());
        try {
            persist(record, true);

            record.setPhase(WorkflowPhase.VALIDATING);
            ValidationResult validation = validator.validate(stepList);
            if (!validation.valid()) {
                return rejectInvalid(record, validation);
            }

            record.setValidationStatus(ValidationStatus.VALID);
            record.setPhase(WorkflowPhase.RUNNING);
            persist(record, false);
            log.info("Workflow '{}' validated: {} steps, {} edges, order={}",
                    workflowId, validation.nodeCount(), validation.edgeCount(), validation.executionOrder());

            return run(record, stepList, validation, agentId);
        } finally {
            MDC.remove("workflowId");
            MDC.remove("executionId");
        }
    }

    // ------------------------------------------------------------------
    // Run phases
    // ------------------------------------------------------------------

    private ExecutionResult rejectInvalid(WorkflowExecutionRecord record, ValidationResult validation) {
        record.setValidationStatus(ValidationStatus.INVALID);
        record.setPhase(WorkflowPhase.INVALID);
        record.setError(validation.error());
        record.finish(ExecutionStatus.FAILED, clock.instant());
        persist(record, false);

        log.warn("Workflow '{}' rejected: {}", record.getWorkflowId(), validation.error());
        countRun("invalid");
        return new ExecutionResult(record.getId(), record.getWorkflowId(), false, Map.of(), false,
                record.getDurationSeconds(), validation.error(), FailureType.VALIDATION,
                null, List.of(), validation);
    }

    private ExecutionResult run(WorkflowExecutionRecord record,
                                List<WorkflowStep> steps,
                                ValidationResult validation,
                                String agentId) {
        Map<String, WorkflowStep> stepsById = new HashMap<>();
        steps.forEach(s -> stepsById.put(s.stepId(), s));

        Map<String, Object> results   = new LinkedHashMap<>();
        List<WorkflowStep>  completed = new ArrayList<>();
        List<String>        skipped   = new ArrayList<>();

        for (String stepId : validation.executionOrder()) {
            WorkflowStep step = stepsById.get(stepId);
            MDC.put("stepId", stepId);
            try {
                if (!shouldRun(step, results)) {
                    skipped.add(stepId);
                    record.incrementStepsSkipped();
                    log.info("Skipping step '{}': condition [{}] is false", stepId, step.condition());
                    continue;
                }

                Map<String, Object> inputs = inputResolver.resolve(step, results);
                log.info("Running step '{}' (skill={})", stepId, step.skillId());
                Object output = stepInvoker.invoke(stepId, step.skillId(), inputs, agentId, step.timeoutSeconds());

                results.put(stepId, output);
                completed.add(step);
                record.incrementStepsExecuted();
                log.info("Step '{}' completed", stepId);
            } catch (StepFailureException e) {
                return failAndRollBack(record, e, completed, results, skipped, validation, agentId);
            } finally {
                MDC.remove("stepId");
            }
        }

        record.setPhase(WorkflowPhase.COMPLETED);
        record.finish(ExecutionStatus.COMPLETED, clock.instant());
        persist(record, false);

        log.info("Workflow '{}' completed in {}s ({} executed, {} skipped)",
                record.getWorkflowId(), record.getDurationSeconds(), completed.size(), skipped.size());
        countRun("completed");
        return new ExecutionResult(record.getId(), record.getWorkflowId(), true, results, false,
                record.getDurationSeconds(), null, null, null, skipped, validation);
    }

    private ExecutionResult failAndRollBack(WorkflowExecutionRecord record,
                                            StepFailureException failure,
                                            List<WorkflowStep> completed,
                                            Map<String, Object> results,
                                            List<String> skipped,
                                            ValidationResult validation,
                                            String agentId) {
        log.error("Workflow '{}' failed at step '{}': {}",
                record.getWorkflowId(), failure.getStepId(), failure.getMessage());
        record.setFailedStepId(failure.getStepId());
        record.setError(failure.getMessage());
        record.setPhase(WorkflowPhase.FAILED);
        persist(record, false);

        record.setPhase(WorkflowPhase.ROLLING_BACK);
        persist(record, false);
        boolean rolledBack = rollbackManager.rollback(record.getWorkflowId(), completed, results, agentId);

        record.setRollbackPerformed(rolledBack);
        record.setPhase(WorkflowPhase.ROLLED_BACK);
        record.finish(ExecutionStatus.FAILED, clock.instant());
        persist(record, false);

        countRun("failed");
        return new ExecutionResult(record.getId(), record.getWorkflowId(), false, results, rolledBack,
                record.getDurationSeconds(), failure.getMessage(), failure.getType(),
                failure.getStepId(), skipped, validation);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** A condition that cannot be evaluated counts as false: the step is skipped, the run goes on. */
    private boolean shouldRun(WorkflowStep step, Map<String, Object> results) {
        if (!step.hasCondition()) {
            return true;
        }
        try {
            return conditionEvaluator.evaluate(step.condition(), results);
        } catch (ConditionException e) {
            log.error("Condition of step '{}' could not be evaluated, skipping it: {}",
                    step.stepId(), e.getMessage());
            return false;
        }
    }

    /**
     * Write the record. The record is for observability only, so a store
     * failure is logged and the run carries on with its real outcome.
     */
    private void persist(WorkflowExecutionRecord record, boolean create) {
        try {
            if (create) {
                recordStore.create(record);
            } else {
                recordStore.update(record);
            }
        } catch (RuntimeException e) {
            log.warn("Could not persist execution record {} (phase={}): {}",
                    record.getId(), record.getPhase(), e.getMessage());
        }
    }

    private void countRun(String outcome) {
        meterRegistry.counter("composer.workflow.runs", "outcome", outcome).increment();
    }
}
