package com.skillflow.composer.graph;

import com.skillflow.composer.model.WorkflowStep;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Builds the dependency graph of a step list and checks that it can be run.
 *
 * Checks, in order:
 * <ol>
 *   <li>Structure: every step has a step_id and skill_id, ids are unique,
 *       timeouts are positive.</li>
 *   <li>Missing dependencies: every dependency names a known step.</li>
 *   <li>Cycles: three-colour DFS (white = unvisited, gray = on the current
 *       path, black = finished). Any edge into a gray node closes a cycle,
 *       which includes a step listing itself as a dependency.</li>
 * </ol>
 * When all pass, Kahn's algorithm produces the execution order. The ready
 * set is ordered by each step's position in the input list, so the same
 * input always yields the same order.
 *
 * Pure function over its argument: no state, safe to share.
 */
@Component
public class WorkflowValidator {

    private enum Color { WHITE, GRAY, BLACK }

    public ValidationResult validate(List<WorkflowStep> steps) {
        List<WorkflowStep> nodes = steps == null ? List.of() : steps;
        List<String> errors = new ArrayList<>();

        // Step id -> position of its first occurrence.
        Map<String, Integer> indexById = new LinkedHashMap<>();
        Set<String> duplicates = new LinkedHashSet<>();
        int edgeCount = 0;

        for (int i = 0; i < nodes.size(); i++) {
            WorkflowStep step = nodes.get(i);
            if (step == null) {
                errors.add("Step at position " + i + " is null");
                continue;
            }
            edgeCount += step.dependencies().size();
            if (isBlank(step.stepId())) {
                errors.add("Step at position " + i + " has no step_id");
                continue;
            }
            if (isBlank(step.skillId())) {
                errors.add("Step '" + step.stepId() + "' has no skill_id");
            }
            if (step.timeoutSeconds() != null && step.timeoutSeconds() <= 0) {
                errors.add("Step '" + step.stepId() + "' has non-positive timeout_seconds: "
                        + step.timeoutSeconds());
            }
            if (indexById.putIfAbsent(step.stepId(), i) != null) {
                duplicates.add(step.stepId());
            }
        }
        if (!duplicates.isEmpty()) {
            errors.add("Duplicate step ids: " + duplicates);
        }

        // ── Missing dependencies ─────────────────────────────────────────────
        Set<String> missing = new LinkedHashSet<>();
        for (WorkflowStep step : nodes) {
            if (step == null || isBlank(step.stepId())) continue;
            List<String> unknown = step.dependencies().stream()
                    .filter(dep -> !indexById.containsKey(dep))
                    .toList();
            if (!unknown.isEmpty()) {
                missing.addAll(unknown);
                errors.add("Step '" + step.stepId() + "' depends on unknown steps: " + unknown);
            }
        }

        // ── Cycles ───────────────────────────────────────────────────────────
        List<List<String>> cycles = findCycles(nodes, indexById);
        for (List<String> cycle : cycles) {
            errors.add("Circular dependency detected: " + String.join(" -> ", cycle));
        }

        if (!errors.isEmpty()) {
            return ValidationResult.invalid(nodes.size(), edgeCount,
                    String.join("; ", errors), cycles, new ArrayList<>(missing));
        }
        return ValidationResult.valid(nodes.size(), edgeCount, topologicalOrder(nodes));
    }

    // ------------------------------------------------------------------
    // Cycle detection
    // ------------------------------------------------------------------

    private List<List<String>> findCycles(List<WorkflowStep> nodes, Map<String, Integer> indexById) {
        Map<String, Color> color = new HashMap<>();
        indexById.keySet().forEach(id -> color.put(id, Color.WHITE));

        List<List<String>> cycles = new ArrayList<>();
        Deque<String> path = new ArrayDeque<>();
        for (String id : indexById.keySet()) {
            if (color.get(id) == Color.WHITE) {
                visit(id, nodes, indexById, color, path, cycles);
            }
        }
        return cycles;
    }

    private void visit(String id,
                       List<WorkflowStep> nodes,
                       Map<String, Integer> indexById,
                       Map<String, Color> color,
                       Deque<String> path,
                       List<List<String>> cycles) {
        color.put(id, Color.GRAY);
        path.addLast(id);

        for (String dep : nodes.get(indexById.get(id)).dependencies()) {
            Color depColor = color.get(dep);
            if (depColor == null) continue;   // missing dependency, reported separately
            if (depColor == Color.GRAY) {
                cycles.add(cyclePath(path, dep));
            } else if (depColor == Color.WHITE) {
                visit(dep, nodes, indexById, color, path, cycles);
            }
        }

        path.removeLast();
        color.put(id, Color.BLACK);
    }

    /** Slice of the current DFS path from {@code closingId} to the top, closed back on itself. */
    private static List<String> cyclePath(Deque<String> path, String closingId) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String id : path) {
            if (id.equals(closingId)) inCycle = true;
            if (inCycle) cycle.add(id);
        }
        cycle.add(closingId);
        return cycle;
    }

    // ------------------------------------------------------------------
    // Topological order (Kahn)
    // ------------------------------------------------------------------

    private static List<String> topologicalOrder(List<WorkflowStep> nodes) {
        Map<String, Integer> indexById = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            indexById.put(nodes.get(i).stepId(), i);
        }

        int[] inDegree = new int[nodes.size()];
        List<List<Integer>> dependents = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) dependents.add(new ArrayList<>());

        for (int i = 0; i < nodes.size(); i++) {
            for (String dep : nodes.get(i).dependencies()) {
                dependents.get(indexById.get(dep)).add(i);
                inDegree[i]++;
            }
        }

        // Smallest input position first among the ready steps.
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < nodes.size(); i++) {
            if (inDegree[i] == 0) ready.add(i);
        }

        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(nodes.get(current).stepId());
            for (int dependent : dependents.get(current)) {
                if (--inDegree[dependent] == 0) ready.add(dependent);
            }
        }

        // Cycle detection has already run; a shortfall here means the two disagree.
        if (order.size() != nodes.size()) {
            throw new IllegalStateException("Topological sort left "
                    + (nodes.size() - order.size()) + " steps unscheduled");
        }
        return order;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
