package com.skillflow.composer.engine;

import com.skillflow.composer.executor.SkillExecutionBackend;
import com.skillflow.composer.executor.dto.SkillResponse;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Calls the skill execution backend for one step, within the step's time budget.
 *
 * The backend call runs on a fixed worker pool so the calling thread can
 * stop waiting after timeout_seconds; the call is then cancelled
 * (interrupted). A backend that ignores interruption keeps its worker
 * busy until it returns, which is why the pool is bounded.
 *
 * Every call is timed and counted:
 * <pre>
 *   composer.step.duration{skill}
 *   composer.step.calls{skill, status="success|failed|timeout|error"}
 * </pre>
 */
@Component
public class StepInvoker {

    private static final Logger log = LoggerFactory.getLogger(StepInvoker.class);

    private final SkillExecutionBackend backend;
    private final MeterRegistry         meterRegistry;
    private final int                   defaultTimeoutSec;
    private final ExecutorService       workers;

    public StepInvoker(SkillExecutionBackend backend,
                       MeterRegistry meterRegistry,
                       @Value("${composer.execution.default-step-timeout-sec:300}") int defaultTimeoutSec,
                       @Value("${composer.execution.worker-threads:8}") int workerThreads) {
        this.backend           = backend;
        this.meterRegistry     = meterRegistry;
        this.defaultTimeoutSec = defaultTimeoutSec;
        this.workers           = Executors.newFixedThreadPool(workerThreads);
    }

    /**
     * Run one skill call and return its result.
     *
     * @param stepId         Step the call belongs to (for errors and logs).
     * @param timeoutSeconds Step budget; null means the configured default.
     * @throws StepFailureException STEP_TIMEOUT when the budget runs out,
     *                              STEP_EXECUTION for every other failure
     */
    public Object invoke(String stepId, String skillId, Map<String, Object> inputs,
                         String agentId, Integer timeoutSeconds) {
        int budget = timeoutSeconds != null ? timeoutSeconds : defaultTimeoutSec;

        // Carry workflowId / executionId / stepId over to the worker thread.
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Timer.Sample sample = Timer.start(meterRegistry);
        String status = "success";
        Future<SkillResponse> call = workers.submit(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return backend.execute(skillId, inputs, agentId);
            } finally {
                MDC.clear();
            }
        });
        try {
            SkillResponse response = call.get(budget, TimeUnit.SECONDS);
            if (response == null || !response.success()) {
                status = "failed";
                String reason = response == null ? "Backend returned no response"
                        : response.error() != null ? response.error()
                        : "Skill '" + skillId + "' reported failure";
                throw new StepFailureException(FailureType.STEP_EXECUTION, stepId, reason);
            }
            return response.result();
        } catch (TimeoutException e) {
            status = "timeout";
            call.cancel(true);
            throw new StepFailureException(FailureType.STEP_TIMEOUT, stepId,
                    "Skill '" + skillId + "' exceeded " + budget + "s timeout", e);
        } catch (ExecutionException e) {
            status = "error";
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StepFailureException(FailureType.STEP_EXECUTION, stepId,
                    "Skill '" + skillId + "' backend error: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            status = "error";
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new StepFailureException(FailureType.STEP_EXECUTION, stepId,
                    "Interrupted while waiting for skill '" + skillId + "'", e);
        } finally {
            sample.stop(meterRegistry.timer("composer.step.duration", "skill", skillId));
            meterRegistry.counter("composer.step.calls", "skill", skillId, "status", status).increment();
            log.debug("Skill '{}' for step '{}' finished with status {}", skillId, stepId, status);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }
}
