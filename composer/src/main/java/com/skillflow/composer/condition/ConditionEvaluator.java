package com.skillflow.composer.condition;

import com.skillflow.composer.condition.ConditionExpression.Reference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Decides whether a step runs, by evaluating its condition against the
 * results of the steps that ran before it.
 *
 * Each step_id in {@code results} is visible to the condition as a name,
 * so {@code extract.get('count') > 10} reads key "count" from the output
 * of step "extract". Absent or blank conditions are always true.
 *
 * Every reference is resolved before the expression is evaluated. If any
 * of them resolves to nothing (unknown or skipped step, missing key without
 * a default, stored null) the condition is false, whatever the operators
 * around it would have made of a null.
 *
 * Conditions are parsed on every call; they are short and the parser is
 * a single pass.
 */
@Component
public class ConditionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    // "b-1": hyphenated step ids are legal, but this is usually subtraction.
    private static final Pattern LOOKS_LIKE_SUBTRACTION = Pattern.compile(".*[A-Za-z_]-\\d+");

    /**
     * @throws ConditionException if the condition is malformed, compares incompatible
     *                            values, or names an unknown step that reads as arithmetic
     */
    public boolean evaluate(String condition, Map<String, Object> results) {
        if (condition == null || condition.isBlank()) {
            return true;
        }
        Map<String, Object> namespace = results == null ? Map.of() : results;
        ConditionExpression expr = ConditionParser.parse(condition);

        for (Reference ref : ConditionExpression.references(expr)) {
            if (ref.evaluate(namespace) != null) continue;

            if (!namespace.containsKey(ref.stepId())
                    && LOOKS_LIKE_SUBTRACTION.matcher(ref.stepId()).matches()) {
                throw new ConditionException(condition, "Arithmetic is not supported, and no step '"
                        + ref.stepId() + "' has a result");
            }
            log.warn("Reference {} not found, condition is false: {}", ref.text(), condition);
            return false;
        }
        return ConditionExpression.isTruthy(expr.evaluate(namespace));
    }
}
