package com.skillflow.composer.store;

import com.skillflow.composer.model.WorkflowExecutionRecord;

/**
 * Write-only view of execution record persistence, as the engine sees it.
 *
 * Implementations must be safe for concurrent use: independent workflow
 * runs call into the same store without any locking on the engine side.
 */
public interface ExecutionRecordStore {

    /** Persist a freshly created record. */
    void create(WorkflowExecutionRecord record);

    /** Persist the current state of an existing record. */
    void update(WorkflowExecutionRecord record);
}
