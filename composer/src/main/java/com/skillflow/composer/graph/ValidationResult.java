package com.skillflow.composer.graph;

import java.util.List;

/**
 * Outcome of validating a step list.
 *
 * @param valid               True when the steps form a DAG with no dangling references.
 * @param nodeCount           Number of steps submitted.
 * @param edgeCount           Number of dependency edges (after de-duplication).
 * @param executionOrder      Step ids in execution order; empty when invalid.
 * @param error               Human-readable summary of every problem found; null when valid.
 * @param cycles              Each detected cycle as a path that starts and ends on the same id.
 * @param missingDependencies Referenced step ids that do not exist, in first-seen order.
 */
public record ValidationResult(
        boolean            valid,
        int                nodeCount,
        int                edgeCount,
        List<String>       executionOrder,
        String             error,
        List<List<String>> cycles,
        List<String>       missingDependencies) {

    public ValidationResult {
        executionOrder      = executionOrder == null ? List.of() : List.copyOf(executionOrder);
        cycles              = cycles == null ? List.of() : cycles.stream().map(List::copyOf).toList();
        missingDependencies = missingDependencies == null ? List.of() : List.copyOf(missingDependencies);
    }

    static ValidationResult valid(int nodeCount, int edgeCount, List<String> order) {
        return new ValidationResult(true, nodeCount, edgeCount, order, null, List.of(), List.of());
    }

    static ValidationResult invalid(int nodeCount, int edgeCount, String error,
                                    List<List<String>> cycles, List<String> missing) {
        return new ValidationResult(false, nodeCount, edgeCount, List.of(), error, cycles, missing);
    }

    public boolean hasCycles() { return !cycles.isEmpty(); }
}
