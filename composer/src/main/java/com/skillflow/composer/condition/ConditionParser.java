package com.skillflow.composer.condition;

import com.skillflow.composer.condition.ConditionExpression.*;
import com.skillflow.composer.condition.ConditionLexer.Token;
import com.skillflow.composer.condition.ConditionLexer.Type;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for step conditions.
 *
 * <pre>
 *   expr       := orExpr
 *   orExpr     := andExpr (("or" | "||") andExpr)*
 *   andExpr    := notExpr (("and" | "&&") notExpr)*
 *   notExpr    := ("not" | "!") notExpr | comparison
 *   comparison := operand (("==" | "!=" | "<" | "<=" | ">" | ">=") operand)?
 *   operand    := literal | reference | "(" expr ")"
 *   reference  := IDENT ( ".get(" key ("," literal)? ")" | "." IDENT | "[" key "]" )*
 *   literal    := NUMBER | STRING | true | True | false | False | null | None
 * </pre>
 *
 * The only call accepted is {@code .get(...)} on a reference; any other
 * call is rejected rather than ignored.
 *
 * Step ids may contain '-', so {@code b-1} is one identifier, not a
 * subtraction. A free-standing '-' ({@code b - 1}) is rejected by the lexer.
 * When {@code b-1} names no step with a result, ConditionEvaluator reports
 * it as unsupported arithmetic.
 */
public final class ConditionParser {

    private final String     source;
    private final List<Token> tokens;
    private int pos = 0;

    private ConditionParser(String source) {
        this.source = source;
        this.tokens = ConditionLexer.tokenize(source);
    }

    /**
     * Parse a condition string.
     *
     * @throws ConditionException on any lexical or syntax error
     */
    public static ConditionExpression parse(String condition) {
        if (condition == null || condition.isBlank()) {
            throw new ConditionException(String.valueOf(condition), "Empty condition");
        }
        ConditionParser parser = new ConditionParser(condition);
        ConditionExpression expr = parser.orExpr();
        parser.expect(Type.EOF, "end of condition");
        return expr;
    }

    // ------------------------------------------------------------------
    // Grammar rules
    // ------------------------------------------------------------------

    private ConditionExpression orExpr() {
        List<ConditionExpression> operands = new ArrayList<>();
        operands.add(andExpr());
        while (accept(Type.OR)) operands.add(andExpr());
        return operands.size() == 1 ? operands.get(0) : new Or(operands);
    }

    private ConditionExpression andExpr() {
        List<ConditionExpression> operands = new ArrayList<>();
        operands.add(notExpr());
        while (accept(Type.AND)) operands.add(notExpr());
        return operands.size() == 1 ? operands.get(0) : new And(operands);
    }

    private ConditionExpression notExpr() {
        if (accept(Type.NOT)) return new Not(notExpr());
        return comparison();
    }

    private ConditionExpression comparison() {
        ConditionExpression left = operand();
        Operator op = switch (peek().type()) {
            case EQ -> Operator.EQ;
            case NE -> Operator.NE;
            case LT -> Operator.LT;
            case LE -> Operator.LE;
            case GT -> Operator.GT;
            case GE -> Operator.GE;
            default -> null;
        };
        if (op == null) return left;
        advance();
        ConditionExpression right = operand();
        if (isComparisonOperator(peek().type())) {
            throw error("Chained comparisons are not supported", peek());
        }
        return new Comparison(op, left, right, source);
    }

    private ConditionExpression operand() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER, STRING -> {
                advance();
                return new Literal(token.value());
            }
            case LPAREN -> {
                advance();
                ConditionExpression inner = orExpr();
                expect(Type.RPAREN, "')'");
                return inner;
            }
            case IDENT -> {
                Object keyword = keywordLiteral(token.text());
                if (keyword != null || isNullKeyword(token.text())) {
                    advance();
                    return new Literal(keyword);
                }
                return reference();
            }
            default -> throw error("Expected a value or step reference", token);
        }
    }

    private ConditionExpression reference() {
        Token name = advance();
        if (peek().type() == Type.LPAREN) {
            throw error("Function calls are not supported: " + name.text() + "(...)", name);
        }

        List<Accessor> path = new ArrayList<>();
        while (true) {
            if (accept(Type.DOT)) {
                Token member = expect(Type.IDENT, "attribute name after '.'");
                if (peek().type() == Type.LPAREN) {
                    if (!"get".equals(member.text())) {
                        throw error("Only .get(...) lookups are supported, found ." + member.text() + "(...)", member);
                    }
                    path.add(getCall());
                } else {
                    path.add(new Accessor(member.text(), null));
                }
            } else if (accept(Type.LBRACKET)) {
                String key = key();
                expect(Type.RBRACKET, "']'");
                path.add(new Accessor(key, null));
            } else {
                return new Reference(name.text(), path);
            }
        }
    }

    /** {@code (key)} or {@code (key, default)} following {@code .get}. */
    private Accessor getCall() {
        expect(Type.LPAREN, "'('");
        String key = key();
        Object defaultValue = null;
        if (accept(Type.COMMA)) {
            defaultValue = literal();
        }
        expect(Type.RPAREN, "')'");
        return new Accessor(key, defaultValue);
    }

    private String key() {
        Token token = peek();
        if (token.type() == Type.STRING || token.type() == Type.NUMBER) {
            advance();
            return String.valueOf(token.value());
        }
        throw error("Lookup key must be a string literal", token);
    }

    private Object literal() {
        Token token = advance();
        if (token.type() == Type.NUMBER || token.type() == Type.STRING) return token.value();
        if (token.type() == Type.IDENT) {
            Object keyword = keywordLiteral(token.text());
            if (keyword != null || isNullKeyword(token.text())) return keyword;
        }
        throw error("Expected a literal", token);
    }

    // ------------------------------------------------------------------
    // Token helpers
    // ------------------------------------------------------------------

    private static Object keywordLiteral(String text) {
        return switch (text) {
            case "true", "True"   -> Boolean.TRUE;
            case "false", "False" -> Boolean.FALSE;
            default               -> null;
        };
    }

    private static boolean isNullKeyword(String text) {
        return "null".equals(text) || "None".equals(text);
    }

    private static boolean isComparisonOperator(Type type) {
        return switch (type) {
            case EQ, NE, LT, LE, GT, GE -> true;
            default -> false;
        };
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.type() != Type.EOF) pos++;
        return token;
    }

    private boolean accept(Type type) {
        if (peek().type() == type) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(Type type, String what) {
        Token token = peek();
        if (token.type() != type) {
            throw error("Expected " + what, token);
        }
        return advance();
    }

    private ConditionException error(String message, Token at) {
        String found = at.type() == Type.EOF ? "end of input" : "'" + at.text() + "'";
        return new ConditionException(source, message + " (found " + found + " at position " + at.position() + ")");
    }
}
