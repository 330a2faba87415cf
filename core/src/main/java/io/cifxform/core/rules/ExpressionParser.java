package io.cifxform.core.rules;

import io.cifxform.core.error.RuleParseException;

/**
 * Recursive-descent parser for {@code CALCULATE} expressions.
 *
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := factor (('*' | '/') factor)*
 * factor     := '-' factor | '(' expression ')' | number | data-name
 * </pre>
 *
 * Not thread-safe; create one per expression.
 */
final class ExpressionParser {

    private final String text;
    private final String source;
    private final int line;
    private int pos;

    ExpressionParser(String text, String source, int line) {
        this.text = text;
        this.source = source;
        this.line = line;
    }

    /** Parses an expression, rejecting trailing input. */
    static Expression parse(String text, String source, int line) {
        ExpressionParser parser = new ExpressionParser(text, source, line);
        Expression expression = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < text.length()) {
            throw parser.error("Unexpected '" + text.charAt(parser.pos) + "'");
        }
        return expression;
    }

    private Expression expression() {
        Expression left = term();
        while (true) {
            skipWhitespace();
            if (peek('+') || peek('-')) {
                char operator = text.charAt(pos++);
                left = new Expression.Binary(operator, left, term());
            } else {
                return left;
            }
        }
    }

    private Expression term() {
        Expression left = factor();
        while (true) {
            skipWhitespace();
            if (peek('*') || peek('/')) {
                char operator = text.charAt(pos++);
                left = new Expression.Binary(operator, left, factor());
            } else {
                return left;
            }
        }
    }

    private Expression factor() {
        skipWhitespace();
        if (pos >= text.length()) {
            throw error("Expression ends unexpectedly");
        }
        char c = text.charAt(pos);
        if (c == '-') {
            pos++;
            return new Expression.Negate(factor());
        }
        if (c == '(') {
            pos++;
            Expression inner = expression();
            skipWhitespace();
            if (!peek(')')) {
                throw error("Missing ')'");
            }
            pos++;
            return inner;
        }
        if (c == '_') {
            return new Expression.FieldRef(dataName());
        }
        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        throw error("Unexpected '" + c + "'");
    }

    private String dataName() {
        int start = pos;
        pos++;
        while (pos < text.length() && (isNameChar(text.charAt(pos)) || isInnerHyphen(pos))) {
            pos++;
        }
        if (pos - start < 2) {
            throw error("Incomplete data name");
        }
        return text.substring(start, pos);
    }

    private Expression number() {
        int start = pos;
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            pos++;
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                    pos++;
                }
            } else {
                pos = mark;
            }
        }
        String literal = text.substring(start, pos);
        try {
            return new Expression.Number(Double.parseDouble(literal));
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + literal + "'");
        }
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '[' || c == ']' || c == '%';
    }

    /** A hyphen between letters, as in {@code _refine_ls.abs_structure_z-score}; {@code _a-_b} still subtracts. */
    private boolean isInnerHyphen(int at) {
        return text.charAt(at) == '-'
                && at + 1 < text.length()
                && Character.isLetter(text.charAt(at + 1))
                && Character.isLetterOrDigit(text.charAt(at - 1));
    }

    private boolean peek(char c) {
        return pos < text.length() && text.charAt(pos) == c;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private RuleParseException error(String message) {
        return new RuleParseException(message + " in expression '" + text + "' at position " + pos, source, line);
    }
}
