package com.skillflow.composer.repository;

import com.skillflow.composer.model.ExecutionStatus;
import com.skillflow.composer.model.WorkflowExecutionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + query operations for the workflow_executions table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface WorkflowExecutionRepository extends JpaRepository<WorkflowExecutionRecord, UUID> {

    /** Every run of a workflow, newest first (operators auditing re-runs). */
    List<WorkflowExecutionRecord> findByWorkflowIdOrderByStartedAtDesc(String workflowId);

    /** Runs currently in a given status (used for monitoring). */
    List<WorkflowExecutionRecord> findByStatus(ExecutionStatus status);
}
