package com.skillflow.composer.store;

import com.skillflow.composer.model.WorkflowExecutionRecord;
import com.skillflow.composer.repository.WorkflowExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link ExecutionRecordStore} backed by Spring Data JPA.
 *
 * Each write runs in its own short transaction; the engine holds no
 * transaction open across skill calls (those can take minutes).
 */
@Component
public class JpaExecutionRecordStore implements ExecutionRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JpaExecutionRecordStore.class);

    private final WorkflowExecutionRepository repository;

    public JpaExecutionRecordStore(WorkflowExecutionRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public void create(WorkflowExecutionRecord record) {
        repository.save(record);
        log.debug("Created execution record {} for workflow '{}'", record.getId(), record.getWorkflowId());
    }

    @Override
    @Transactional
    public void update(WorkflowExecutionRecord record) {
        repository.save(record);
        log.debug("Updated execution record {} (phase={}, status={})",
                record.getId(), record.getPhase(), record.getStatus());
    }
}
