package com.skillflow.composer.condition;

import com.skillflow.composer.condition.ConditionExpression.Comparison;
import com.skillflow.composer.condition.ConditionExpression.Operator;
import com.skillflow.composer.condition.ConditionExpression.Reference;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ConditionParser.
 *
 * Focus on what the grammar refuses: anything beyond lookups and
 * comparisons must fail to parse rather than be evaluated.
 */
class ConditionParserTest {

    // ------------------------------------------------------------------
    // Accepted shapes
    // ------------------------------------------------------------------

    @Test
    void parse_comparison_buildsComparisonNode() {
        ConditionExpression expr = ConditionParser.parse("stepA.get('count') >= 10");

        assertThat(expr).isInstanceOf(Comparison.class);
        Comparison cmp = (Comparison) expr;
        assertThat(cmp.operator()).isEqualTo(Operator.GE);
        assertThat(cmp.left()).isInstanceOf(Reference.class);
        assertThat(((Reference) cmp.left()).stepId()).isEqualTo("stepA");
        assertThat(((Reference) cmp.left()).path()).hasSize(1);
    }

    @Test
    void parse_negativeNumberLiteral() {
        assertThat(ConditionParser.parse("a.get('delta') > -5")).isInstanceOf(Comparison.class);
    }

    // ------------------------------------------------------------------
    // Rejected shapes
    // ------------------------------------------------------------------

    @Test
    void parse_arbitraryFunctionCall_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("exec('rm -rf /')"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Function calls are not supported");
    }

    @Test
    void parse_methodOtherThanGet_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("stepA.keys() == 1"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Only .get(...)");
    }

    @Test
    void parse_dunderAttributeCall_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("stepA.__class__.__subclasses__()"))
                .isInstanceOf(ConditionException.class);
    }

    @Test
    void parse_assignment_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("x = 1"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Assignment");
    }

    @Test
    void parse_arithmetic_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("a.get('n') + 1 > 2"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Unexpected character '+'");
    }

    @Test
    void parse_statementSeparator_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("a.get('ok'); import os"))
                .isInstanceOf(ConditionException.class);
    }

    @Test
    void parse_nonLiteralLookupKey_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("a.get(b) == 1"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Lookup key must be a string literal");
    }

    @Test
    void parse_chainedComparison_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("1 < a.get('n') < 5"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Chained comparisons");
    }

    @Test
    void parse_unterminatedString_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("a.get('ok) == 1"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Unterminated string");
    }

    @Test
    void parse_unbalancedParenthesis_rejected() {
        assertThatThrownBy(() -> ConditionParser.parse("(a.get('ok') == 1"))
                .isInstanceOf(ConditionException.class)
                .hasMessageContaining("Expected ')'");
    }
}
