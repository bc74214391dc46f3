package com.skillflow.composer.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Metadata row describing one invocation of a workflow.
 *
 * Created when execution starts, written again after validation and once
 * more when the run finishes. The engine never reads it back and never
 * deletes it; retention is handled outside the engine.
 *
 * The id is generated by the engine, not taken from the caller, so that
 * re-running the same workflow_id produces a new row instead of colliding.
 *
 * DB table: workflow_executions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "workflow_executions")
public class WorkflowExecutionRecord {

    @Id
    private UUID id;

    // Caller-supplied, not unique across time.
    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "agent_id")
    private String agentId;

    // Null until validation has run.
    @Enumerated(EnumType.STRING)
    @Column(name = "validation_status")
    private ValidationStatus validationStatus;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.RUNNING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkflowPhase phase = WorkflowPhase.CREATED;

    @Column(name = "rollback_performed", nullable = false)
    private boolean rollbackPerformed = false;

    @Column(name = "step_count", nullable = false)
    private int stepCount;

    @Column(name = "steps_executed", nullable = false)
    private int stepsExecuted = 0;

    @Column(name = "steps_skipped", nullable = false)
    private int stepsSkipped = 0;

    @Column(name = "failed_step_id")
    private String failedStepId;

    @Column(name = "error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected WorkflowExecutionRecord() {}   // required by JPA

    public WorkflowExecutionRecord(String workflowId, String agentId, int stepCount, Instant startedAt) {
        this.id         = UUID.randomUUID();
        this.workflowId = workflowId;
        this.agentId    = agentId;
        this.stepCount  = stepCount;
        this.startedAt  = startedAt;
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    /**
     * Stamp completion time and derive the duration from started_at.
     * Duration is clamped at zero in case the clock stepped backwards.
     */
    public void finish(ExecutionStatus finalStatus, Instant completedAt) {
        this.status          = finalStatus;
        this.completedAt     = completedAt;
        double seconds       = (completedAt.toEpochMilli() - startedAt.toEpochMilli()) / 1000.0;
        this.durationSeconds = Math.max(0.0, seconds);
    }

    public void incrementStepsExecuted() { this.stepsExecuted++; }
    public void incrementStepsSkipped()  { this.stepsSkipped++; }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID             getId()                { return id; }
    public String           getWorkflowId()        { return workflowId; }
    public String           getAgentId()           { return agentId; }
    public ValidationStatus getValidationStatus()  { return validationStatus; }
    public ExecutionStatus  getStatus()            { return status; }
    public WorkflowPhase    getPhase()             { return phase; }
    public boolean          isRollbackPerformed()  { return rollbackPerformed; }
    public int              getStepCount()         { return stepCount; }
    public int              getStepsExecuted()     { return stepsExecuted; }
    public int              getStepsSkipped()      { return stepsSkipped; }
    public String           getFailedStepId()      { return failedStepId; }
    public String           getError()             { return error; }
    public Instant          getStartedAt()         { return startedAt; }
    public Instant          getCompletedAt()       { return completedAt; }
    public Double           getDurationSeconds()   { return durationSeconds; }

    public void setValidationStatus(ValidationStatus v)  { this.validationStatus = v; }
    public void setPhase(WorkflowPhase phase)             { this.phase = phase; }
    public void setRollbackPerformed(boolean v)           { this.rollbackPerformed = v; }
    public void setFailedStepId(String failedStepId)      { this.failedStepId = failedStepId; }
    public void setError(String error)                    { this.error = error; }

    @Override
    public String toString() {
        return "WorkflowExecutionRecord{id=" + id
                + ", workflowId=" + workflowId
                + ", phase=" + phase
                + ", status=" + status + "}";
    }
}
