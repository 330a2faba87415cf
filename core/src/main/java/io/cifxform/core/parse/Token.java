package io.cifxform.core.parse;

import io.cifxform.core.model.Span;
import java.util.Objects;

/**
 * A positioned lexical token.
 *
 * @param type    token kind
 * @param text    token content; unquoted for quoted values
 * @param span    source range, delimiters included
 * @param line    1-based line where the token starts
 * @param endLine 1-based line where the token ends
 */
public record Token(TokenType type, String text, Span span, int line, int endLine) {

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(span, "span must not be null");
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line;
    }
}
