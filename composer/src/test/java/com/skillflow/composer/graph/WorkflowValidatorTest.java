package com.skillflow.composer.graph;

import com.skillflow.composer.model.WorkflowStep;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for WorkflowValidator.
 * Pure function over a step list. No Spring context, no mocks.
 */
class WorkflowValidatorTest {

    WorkflowValidator validator = new WorkflowValidator();

    // ------------------------------------------------------------------
    // Cycles
    // ------------------------------------------------------------------

    @Test
    void validate_selfDependency_isCycle() {
        ValidationResult result = validator.validate(List.of(step("a", "a")));

        assertThat(result.valid()).isFalse();
        assertThat(result.cycles()).containsExactly(List.of("a", "a"));
        assertThat(result.executionOrder()).isEmpty();
        assertThat(result.error()).contains("Circular dependency");
    }

    @Test
    void validate_twoNodeCycle_invalid() {
        ValidationResult result = validator.validate(List.of(
                step("a", "b"),
                step("b", "a")));

        assertThat(result.valid()).isFalse();
        assertThat(result.hasCycles()).isTrue();
        assertThat(result.cycles().get(0)).containsExactly("a", "b", "a");
    }

    @Test
    void validate_cycleBehindValidPrefix_reportsOnlyCycleMembers() {
        // root → x → y → z → x
        ValidationResult result = validator.validate(List.of(
                step("root"),
                step("x", "root", "z"),
                step("y", "x"),
                step("z", "y")));

        assertThat(result.valid()).isFalse();
        assertThat(result.cycles()).hasSize(1);
        assertThat(result.cycles().get(0)).doesNotContain("root");
        assertThat(result.cycles().get(0)).contains("x", "y", "z");
    }

    // ------------------------------------------------------------------
    // Missing dependencies
    // ------------------------------------------------------------------

    @Test
    void validate_unknownDependency_namedInError() {
        ValidationResult result = validator.validate(List.of(
                step("a"),
                step("b", "a", "ghost")));

        assertThat(result.valid()).isFalse();
        assertThat(result.missingDependencies()).containsExactly("ghost");
        assertThat(result.error()).contains("ghost");
        assertThat(result.executionOrder()).isEmpty();
    }

    @Test
    void validate_severalUnknownDependencies_allListed() {
        ValidationResult result = validator.validate(List.of(
                step("a", "missing1"),
                step("b", "missing2", "missing1")));

        assertThat(result.missingDependencies()).containsExactly("missing1", "missing2");
        assertThat(result.error()).contains("missing1").contains("missing2");
    }

    // ------------------------------------------------------------------
    // Structural checks
    // ------------------------------------------------------------------

    @Test
    void validate_duplicateStepIds_invalid() {
        ValidationResult result = validator.validate(List.of(step("a"), step("a")));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).contains("Duplicate step ids").contains("a");
    }

    @Test
    void validate_blankSkillId_invalid() {
        WorkflowStep noSkill = WorkflowStep.of("a", " ", Map.of());

        ValidationResult result = validator.validate(List.of(noSkill));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).contains("no skill_id");
    }

    @Test
    void validate_nonPositiveTimeout_invalid() {
        ValidationResult result = validator.validate(List.of(step("a").withTimeoutSeconds(0)));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).contains("timeout_seconds");
    }

    @Test
    void validate_emptyWorkflow_validWithNoOrder() {
        ValidationResult result = validator.validate(List.of());

        assertThat(result.valid()).isTrue();
        assertThat(result.nodeCount()).isZero();
        assertThat(result.executionOrder()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Topological order
    // ------------------------------------------------------------------

    @Test
    void validate_diamond_everyStepAfterItsDependencies() {
        List<WorkflowStep> steps = List.of(
                step("report", "left", "right"),
                step("right", "source"),
                step("left", "source"),
                step("source"));

        ValidationResult result = validator.validate(steps);

        assertThat(result.valid()).isTrue();
        assertThat(result.nodeCount()).isEqualTo(4);
        assertThat(result.edgeCount()).isEqualTo(4);
        assertDependenciesFirst(steps, result.executionOrder());
    }

    @Test
    void validate_independentSteps_keepInputOrder() {
        ValidationResult result = validator.validate(List.of(step("c"), step("a"), step("b")));

        assertThat(result.executionOrder()).containsExactly("c", "a", "b");
    }

    @Test
    void validate_readyTies_brokenByInputPosition() {
        // Once "root" finishes, "z" and "m" become ready together; "z" was listed first.
        ValidationResult result = validator.validate(List.of(
                step("z", "root"),
                step("root"),
                step("m", "root")));

        assertThat(result.executionOrder()).containsExactly("root", "z", "m");
    }

    @Test
    void validate_sameInputTwice_sameOrder() {
        List<WorkflowStep> steps = List.of(
                step("e", "c", "d"),
                step("d", "a"),
                step("c", "a", "b"),
                step("b"),
                step("a"));

        ValidationResult first  = validator.validate(steps);
        ValidationResult second = validator.validate(steps);

        assertThat(first.executionOrder()).isEqualTo(second.executionOrder());
        assertDependenciesFirst(steps, first.executionOrder());
    }

    @Test
    void validate_duplicateDependencyEntries_countedOnce() {
        ValidationResult result = validator.validate(List.of(step("a"), step("b", "a", "a")));

        assertThat(result.valid()).isTrue();
        assertThat(result.edgeCount()).isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static WorkflowStep step(String id, String... deps) {
        return WorkflowStep.of(id, "skill." + id, Map.of(), deps);
    }

    private static void assertDependenciesFirst(List<WorkflowStep> steps, List<String> order) {
        assertThat(order).hasSize(steps.size());
        for (WorkflowStep s : steps) {
            for (String dep : s.dependencies()) {
                assertThat(order.indexOf(dep))
                        .as("%s must run before %s", dep, s.stepId())
                        .isLessThan(order.indexOf(s.stepId()));
            }
        }
    }
}
