package com.skillflow.composer.engine;

import com.skillflow.composer.model.Compensation;
import com.skillflow.composer.model.WorkflowStep;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Best-effort saga rollback after a step failure.
 *
 * Rollback is not transactional. Completed steps are walked in reverse
 * completion order; a step that registered a {@link Compensation} has its
 * compensating skill called, a step without one is left as it is.
 * The compensating call receives the compensation's static inputs plus
 * {@code original_step_id} and {@code original_result}.
 *
 * A failing compensation is logged and counted, and the walk continues.
 * It never replaces the step failure that caused the rollback.
 */
@Component
public class RollbackManager {

    private static final Logger log = LoggerFactory.getLogger(RollbackManager.class);

    static final String ORIGINAL_STEP_ID = "original_step_id";
    static final String ORIGINAL_RESULT  = "original_result";

    private final StepInvoker   stepInvoker;
    private final MeterRegistry meterRegistry;

    public RollbackManager(StepInvoker stepInvoker, MeterRegistry meterRegistry) {
        this.stepInvoker   = stepInvoker;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Compensate the given steps, newest first.
     *
     * @param completedSteps steps in the order they completed
     * @param results        outputs of those steps, keyed by step_id
     * @return always true: the run counts as rolled back once this is invoked
     */
    public boolean rollback(String workflowId, List<WorkflowStep> completedSteps,
                            Map<String, Object> results, String agentId) {
        log.warn("Rolling back workflow '{}': {} completed step(s)", workflowId, completedSteps.size());

        int compensated = 0;
        int failed      = 0;
        for (int i = completedSteps.size() - 1; i >= 0; i--) {
            WorkflowStep step = completedSteps.get(i);
            if (!step.hasCompensation()) {
                log.debug("Step '{}' has no compensation, nothing to undo", step.stepId());
                continue;
            }

            Compensation compensation = step.compensation();
            Map<String, Object> inputs = new LinkedHashMap<>(compensation.inputs());
            inputs.put(ORIGINAL_STEP_ID, step.stepId());
            inputs.put(ORIGINAL_RESULT,  results.get(step.stepId()));

            try {
                stepInvoker.invoke(step.stepId(), compensation.skillId(), inputs, agentId, step.timeoutSeconds());
                compensated++;
                meterRegistry.counter("composer.rollback.compensations", "status", "success").increment();
                log.info("Compensated step '{}' with skill '{}'", step.stepId(), compensation.skillId());
            } catch (RuntimeException e) {
                failed++;
                meterRegistry.counter("composer.rollback.compensations", "status", "failed").increment();
                log.warn("Compensation of step '{}' with skill '{}' failed, continuing rollback: {}",
                        step.stepId(), compensation.skillId(), e.getMessage());
            }
        }

        log.info("Rollback of workflow '{}' finished: {} compensated, {} failed",
                workflowId, compensated, failed);
        return true;
    }
}
