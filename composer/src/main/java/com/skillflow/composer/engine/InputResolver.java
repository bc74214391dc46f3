package com.skillflow.composer.engine;

import com.skillflow.composer.model.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes the inputs a step is actually called with.
 *
 * Starts from the step's static inputs, then merges the output of each
 * dependency in declared order. Dependency keys override static inputs,
 * and a later dependency overrides an earlier one (last write wins).
 * Outputs that are not maps, and dependencies that were skipped, add nothing.
 *
 * A dependency overwriting a key written by an earlier dependency is legal
 * but logged at WARN, since it is easy to do by accident.
 */
@Component
public class InputResolver {

    private static final Logger log = LoggerFactory.getLogger(InputResolver.class);

    public Map<String, Object> resolve(WorkflowStep step, Map<String, Object> results) {
        Map<String, Object> resolved = new LinkedHashMap<>(step.inputs());
        Map<String, String> writtenBy = new HashMap<>();

        for (String dependency : step.dependencies()) {
            Object output = results.get(dependency);
            if (!(output instanceof Map<?, ?> map)) {
                continue;
            }
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = String.valueOf(entry.getKey());
                String previous = writtenBy.put(key, dependency);
                if (previous != null) {
                    log.warn("Step '{}': input '{}' from dependency '{}' overrides the value from '{}'",
                            step.stepId(), key, dependency, previous);
                }
                resolved.put(key, entry.getValue());
            }
        }
        return Collections.unmodifiableMap(resolved);
    }
}
