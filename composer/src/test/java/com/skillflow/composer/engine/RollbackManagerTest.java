package com.skillflow.composer.engine;

import com.skillflow.composer.model.Compensation;
import com.skillflow.composer.model.WorkflowStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RollbackManager.
 *
 * StepInvoker is mocked, so compensations are recorded rather than sent anywhere.
 */
@ExtendWith(MockitoExtension.class)
class RollbackManagerTest {

    @Mock StepInvoker stepInvoker;

    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    RollbackManager     manager;

    @BeforeEach
    void setUp() {
        manager = new RollbackManager(stepInvoker, meters);
    }

    @Test
    void rollback_compensatesInReverseCompletionOrder() {
        WorkflowStep a = compensated("a", "undo.a");
        WorkflowStep b = compensated("b", "undo.b");
        WorkflowStep c = compensated("c", "undo.c");

        manager.rollback("wf", List.of(a, b, c), Map.of(), "agent");

        InOrder order = inOrder(stepInvoker);
        order.verify(stepInvoker).invoke(eq("c"), eq("undo.c"), anyMap(), eq("agent"), any());
        order.verify(stepInvoker).invoke(eq("b"), eq("undo.b"), anyMap(), eq("agent"), any());
        order.verify(stepInvoker).invoke(eq("a"), eq("undo.a"), anyMap(), eq("agent"), any());
    }

    @Test
    void rollback_stepsWithoutCompensation_leftAlone() {
        WorkflowStep plain = WorkflowStep.of("plain", "skill.plain", Map.of());
        WorkflowStep undoable = compensated("undoable", "undo.it");

        manager.rollback("wf", List.of(plain, undoable), Map.of(), "agent");

        verify(stepInvoker, times(1)).invoke(any(), any(), anyMap(), any(), any());
        verify(stepInvoker, never()).invoke(eq("plain"), any(), anyMap(), any(), any());
    }

    @Test
    void rollback_compensationReceivesOriginalResultAndStaticInputs() {
        WorkflowStep charge = WorkflowStep.of("charge", "payments.charge", Map.of())
                .withCompensation(new Compensation("payments.refund", Map.of("reason", "rollback")));
        Map<String, Object> results = Map.of("charge", Map.of("charge_id", "ch_1"));

        manager.rollback("wf", List.of(charge), results, "agent");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> inputs = ArgumentCaptor.forClass(Map.class);
        verify(stepInvoker).invoke(eq("charge"), eq("payments.refund"), inputs.capture(), eq("agent"), any());
        assertThat(inputs.getValue())
                .containsEntry("reason", "rollback")
                .containsEntry(RollbackManager.ORIGINAL_STEP_ID, "charge")
                .containsEntry(RollbackManager.ORIGINAL_RESULT, Map.of("charge_id", "ch_1"));
    }

    @Test
    void rollback_failingCompensation_remainingStillRun() {
        WorkflowStep a = compensated("a", "undo.a");
        WorkflowStep b = compensated("b", "undo.b");
        when(stepInvoker.invoke(any(), any(), anyMap(), any(), any())).thenAnswer(call -> {
            if ("b".equals(call.getArgument(0))) {
                throw new StepFailureException(FailureType.STEP_EXECUTION, "b", "refund service down");
            }
            return Map.of();
        });

        boolean rolledBack = manager.rollback("wf", List.of(a, b), Map.of(), "agent");

        assertThat(rolledBack).isTrue();
        verify(stepInvoker).invoke(eq("a"), eq("undo.a"), anyMap(), any(), any());
        assertThat(meters.counter("composer.rollback.compensations", "status", "failed").count()).isEqualTo(1.0);
        assertThat(meters.counter("composer.rollback.compensations", "status", "success").count()).isEqualTo(1.0);
    }

    @Test
    void rollback_nothingCompleted_stillReportsRolledBack() {
        assertThat(manager.rollback("wf", List.of(), Map.of(), "agent")).isTrue();
        verifyNoInteractions(stepInvoker);
    }

    private static WorkflowStep compensated(String id, String undoSkill) {
        return WorkflowStep.of(id, "skill." + id, Map.of())
                .withCompensation(new Compensation(undoSkill, Map.of()));
    }
}
