package com.skillflow.composer.condition;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a condition string into tokens.
 *
 * Only the characters the condition grammar needs are accepted; anything
 * else (arithmetic, assignment, semicolons, backticks ...) is rejected here,
 * before the parser ever sees it.
 */
final class ConditionLexer {

    enum Type {
        IDENT, NUMBER, STRING,
        DOT, COMMA, LPAREN, RPAREN, LBRACKET, RBRACKET,
        EQ, NE, LT, LE, GT, GE,
        AND, OR, NOT,
        EOF
    }

    record Token(Type type, String text, Object value, int position) {}

    private final String source;
    private int pos = 0;

    private ConditionLexer(String source) {
        this.source = source;
    }

    static List<Token> tokenize(String source) {
        return new ConditionLexer(source).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(Type.EOF, "", null, pos));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private Token next() {
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isLetter(c) || c == '_') return identifier(start);
        if (Character.isDigit(c) || (c == '-' && isDigitAt(pos + 1))) return number(start);
        if (c == '\'' || c == '"') return string(start, c);

        switch (c) {
            case '.': pos++; return new Token(Type.DOT, ".", null, start);
            case ',': pos++; return new Token(Type.COMMA, ",", null, start);
            case '(': pos++; return new Token(Type.LPAREN, "(", null, start);
            case ')': pos++; return new Token(Type.RPAREN, ")", null, start);
            case '[': pos++; return new Token(Type.LBRACKET, "[", null, start);
            case ']': pos++; return new Token(Type.RBRACKET, "]", null, start);
            case '=':
                if (peek(1) == '=') { pos += 2; return new Token(Type.EQ, "==", null, start); }
                throw error("Assignment is not supported", start);
            case '!':
                if (peek(1) == '=') { pos += 2; return new Token(Type.NE, "!=", null, start); }
                pos++;
                return new Token(Type.NOT, "!", null, start);
            case '<':
                if (peek(1) == '=') { pos += 2; return new Token(Type.LE, "<=", null, start); }
                pos++;
                return new Token(Type.LT, "<", null, start);
            case '>':
                if (peek(1) == '=') { pos += 2; return new Token(Type.GE, ">=", null, start); }
                pos++;
                return new Token(Type.GT, ">", null, start);
            case '&':
                if (peek(1) == '&') { pos += 2; return new Token(Type.AND, "&&", null, start); }
                break;
            case '|':
                if (peek(1) == '|') { pos += 2; return new Token(Type.OR, "||", null, start); }
                break;
            default:
                break;
        }
        throw error("Unexpected character '" + c + "'", start);
    }

    private Token identifier(int start) {
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '-') pos++;
            else break;
        }
        String text = source.substring(start, pos);
        return switch (text) {
            case "and" -> new Token(Type.AND, text, null, start);
            case "or"  -> new Token(Type.OR,  text, null, start);
            case "not" -> new Token(Type.NOT, text, null, start);
            default    -> new Token(Type.IDENT, text, null, start);
        };
    }

    private Token number(int start) {
        if (source.charAt(pos) == '-') pos++;
        while (isDigitAt(pos)) pos++;
        boolean decimal = false;
        if (peek(0) == '.' && isDigitAt(pos + 1)) {
            decimal = true;
            pos++;
            while (isDigitAt(pos)) pos++;
        }
        String text = source.substring(start, pos);
        Object value;
        if (decimal) {
            value = new BigDecimal(text);
        } else {
            try {
                value = Long.parseLong(text);
            } catch (NumberFormatException e) {
                value = new BigDecimal(text);
            }
        }
        return new Token(Type.NUMBER, text, value, start);
    }

    private Token string(int start, char quote) {
        pos++;   // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(Type.STRING, source.substring(start, pos), sb.toString(), start);
            }
            if (c == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    default  -> sb.append(escaped);
                }
            } else {
                sb.append(c);
            }
        }
        throw error("Unterminated string literal", start);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) pos++;
    }

    private char peek(int offset) {
        int i = pos + offset;
        return i < source.length() ? source.charAt(i) : '\0';
    }

    private boolean isDigitAt(int i) {
        return i < source.length() && Character.isDigit(source.charAt(i));
    }

    private ConditionException error(String message, int at) {
        return new ConditionException(source, message + " at position " + at);
    }
}
