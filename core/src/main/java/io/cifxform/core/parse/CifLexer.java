package io.cifxform.core.parse;

import io.cifxform.core.error.CifParseException;
import io.cifxform.core.model.Span;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Single-pass tokenizer for CIF text.
 *
 * <p>
 * Whether a word is a data name is decided here, by lexer state, and never by pattern matching
 * over the output: text-block bodies, triple-quoted values and comments are emitted as single
 * opaque tokens, so a string that looks like a data name inside them is never reported as one.
 *
 * <p>
 * States:
 * <ul>
 * <li>{@code TOP_LEVEL}: data names, values, headers and keywords.</li>
 * <li>{@code IN_LOOP_HEADER}: after {@code loop_}; data names are column declarations.</li>
 * <li>{@code IN_LOOP_ROW}: after the first loop value. A blank line, a data name or any keyword ends
 * the loop.</li>
 * <li>{@code IN_TEXT_BLOCK}: between an opening {@code ;} at column 0 and a line that is exactly
 * {@code ;}.</li>
 * <li>{@code IN_TRIPLE_QUOTE}: between triple-quote delimiters.</li>
 * </ul>
 *
 * <p>
 * Text that opens with the {@code #\#CIF_2.0} magic comment is lexed with CIF2 rules: a quoted
 * value closes at the next matching quote whether or not whitespace follows, and a bracketed list
 * or table ({@code [...]}, {@code {...}}) is read, nesting included, as one opaque
 * {@link TokenType#COMPOUND} token.
 *
 * <p>
 * The lexer is an iterator: tokens are produced lazily and the sequence cannot be restarted.
 * Malformed input raises {@link CifParseException} carrying the offset just past the last good
 * token; there is no recovery. Not thread-safe.
 */
public final class CifLexer implements Iterator<Token> {

    enum State {
        TOP_LEVEL,
        IN_LOOP_HEADER,
        IN_LOOP_ROW,
        IN_TEXT_BLOCK,
        IN_TRIPLE_QUOTE
    }

    private static final char BYTE_ORDER_MARK = '\uFEFF';
    private static final String CIF2_MAGIC = "#\\#CIF_2.0";

    private final String text;
    private final String sourceName;
    private final boolean cif2;

    private int pos;
    private int line = 1;
    private boolean atLineStart = true;
    private State state = State.TOP_LEVEL;
    private State resumeState = State.TOP_LEVEL;
    private boolean valuePending;
    private int loopColumns;
    private int lastGoodOffset;
    private int textBlockOpenLine;

    private Token lookahead;
    private Token pendingClose;
    private boolean exhausted;

    public CifLexer(String text, String sourceName) {
        this.text = text;
        this.sourceName = sourceName;
        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            pos = 1;
        }
        int afterMagic = pos + CIF2_MAGIC.length();
        this.cif2 = text.startsWith(CIF2_MAGIC, pos)
                && (text.length() == afterMagic || isWhitespace(text.charAt(afterMagic)));
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null && !exhausted) {
            lookahead = scan();
            exhausted = lookahead == null;
        }
        return lookahead != null;
    }

    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens in " + sourceName);
        }
        Token token = lookahead;
        lookahead = null;
        return token;
    }

    /** Offset just past the last token handed out successfully. */
    public int lastGoodOffset() {
        return lastGoodOffset;
    }

    /** Returns {@code true} if the text carries the CIF2 magic comment and is lexed with CIF2 rules. */
    public boolean isCif2() {
        return cif2;
    }

    State state() {
        return state;
    }

    private Token scan() {
        if (pendingClose != null) {
            Token close = pendingClose;
            pendingClose = null;
            return emit(close);
        }
        if (state == State.IN_TEXT_BLOCK) {
            return emit(scanTextBlockBody());
        }
        while (pos < text.length()) {
            if (atLineStart) {
                int contentEnd = lineContentEnd(pos);
                if (isBlank(pos, contentEnd)) {
                    return emit(blankLine(contentEnd));
                }
                atLineStart = false;
                if (text.charAt(pos) == ';') {
                    return emit(openTextBlock());
                }
            }
            char c = text.charAt(pos);
            if (c == ' ' || c == '\t') {
                pos++;
            } else if (c == '\n' || c == '\r') {
                pos = afterTerminator(pos);
                line++;
                atLineStart = true;
            } else if (c == '#') {
                return emit(scanComment());
            } else if (text.startsWith("'''", pos) || text.startsWith("\"\"\"", pos)) {
                return emit(scanTripleQuoted());
            } else if (c == '\'' || c == '"') {
                return emit(scanQuoted(c));
            } else if (cif2 && (c == '[' || c == '{')) {
                return emit(scanCompound());
            } else {
                return emit(scanWord());
            }
        }
        return null;
    }

    private Token emit(Token token) {
        lastGoodOffset = token.span().end();
        return token;
    }

    // ── Lines ──

    private Token blankLine(int contentEnd) {
        int start = pos;
        int end = afterTerminator(contentEnd);
        Token blank = new Token(TokenType.BLANK_LINE, "", new Span(start, end), line, line);
        if (end > contentEnd) {
            line++;
        }
        pos = end;
        atLineStart = true;
        if (state == State.IN_LOOP_ROW) {
            state = State.TOP_LEVEL;
        }
        return blank;
    }

    private Token scanComment() {
        int end = lineContentEnd(pos);
        Token comment = new Token(TokenType.COMMENT, text.substring(pos, end), new Span(pos, end), line, line);
        pos = end;
        return comment;
    }

    // ── Text blocks ──

    private Token openTextBlock() {
        boolean valueExpected = (state == State.TOP_LEVEL && valuePending)
                || state == State.IN_LOOP_ROW
                || (state == State.IN_LOOP_HEADER && loopColumns > 0);
        if (!valueExpected) {
            throw error("Text block opened where no value is expected");
        }
        resumeState = state == State.TOP_LEVEL ? State.TOP_LEVEL : State.IN_LOOP_ROW;
        valuePending = false;
        state = State.IN_TEXT_BLOCK;
        textBlockOpenLine = line;
        Token open = new Token(TokenType.TEXT_BLOCK_OPEN, ";", new Span(pos, pos + 1), line, line);
        pos++;
        return open;
    }

    private Token scanTextBlockBody() {
        int bodyStart = pos;
        int lineEnd = lineContentEnd(pos);
        int closeStart = -1;
        while (lineEnd < text.length()) {
            int nextLine = afterTerminator(lineEnd);
            if (nextLine < text.length() && text.charAt(nextLine) == ';') {
                int closeContentEnd = lineContentEnd(nextLine + 1);
                if (isBlank(nextLine + 1, closeContentEnd)) {
                    closeStart = nextLine;
                    break;
                }
            }
            lineEnd = lineContentEnd(nextLine);
        }
        if (closeStart < 0) {
            throw new CifParseException(
                    "Unterminated text block opened at line " + textBlockOpenLine,
                    sourceName,
                    lastGoodOffset,
                    textBlockOpenLine);
        }
        int startLine = line;
        line += countLineBreaks(bodyStart, closeStart);
        Token body = new Token(
                TokenType.TEXT_BLOCK_BODY,
                text.substring(bodyStart, closeStart),
                new Span(bodyStart, closeStart),
                startLine,
                line);
        pendingClose = new Token(TokenType.TEXT_BLOCK_CLOSE, ";", new Span(closeStart, closeStart + 1), line, line);
        pos = closeStart + 1;
        atLineStart = false;
        state = resumeState;
        return body;
    }

    // ── Quoted values ──

    private Token scanQuoted(char quote) {
        int start = pos;
        int i = pos + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                break;
            }
            if (c == quote && (cif2 || i + 1 == text.length() || isWhitespace(text.charAt(i + 1)))) {
                Token quoted =
                        new Token(TokenType.QUOTED, text.substring(start + 1, i), new Span(start, i + 1), line, line);
                pos = i + 1;
                onValue();
                return quoted;
            }
            i++;
        }
        throw error("Unterminated quoted value");
    }

    private Token scanTripleQuoted() {
        State previous = state;
        state = State.IN_TRIPLE_QUOTE;
        String delimiter = text.substring(pos, pos + 3);
        int close = text.indexOf(delimiter, pos + 3);
        if (close < 0) {
            throw error("Unterminated triple-quoted value");
        }
        int startLine = line;
        int end = close + 3;
        line += countLineBreaks(pos, end);
        Token quoted =
                new Token(TokenType.TRIPLE_QUOTED, text.substring(pos + 3, close), new Span(pos, end), startLine, line);
        pos = end;
        state = previous;
        onValue();
        return quoted;
    }

    // ── CIF2 lists and tables ──

    private Token scanCompound() {
        int start = pos;
        int startLine = line;
        Deque<Character> open = new ArrayDeque<>();
        int i = pos;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '[' || c == '{') {
                open.push(c == '[' ? ']' : '}');
                i++;
            } else if (c == ']' || c == '}') {
                if (open.isEmpty() || open.pop() != c) {
                    throw error("Mismatched '" + c + "' in list or table");
                }
                i++;
                if (open.isEmpty()) {
                    Token compound = new Token(
                            TokenType.COMPOUND, text.substring(start, i), new Span(start, i), startLine, line);
                    pos = i;
                    onValue();
                    return compound;
                }
            } else if (c == '\n' || c == '\r') {
                i = afterTerminator(i);
                line++;
                if (i < text.length() && text.charAt(i) == ';') {
                    i = skipNestedTextField(i, startLine);
                }
            } else if (text.startsWith("'''", i) || text.startsWith("\"\"\"", i)) {
                int close = text.indexOf(text.substring(i, i + 3), i + 3);
                if (close < 0) {
                    throw error("Unterminated triple-quoted value in list or table");
                }
                line += countLineBreaks(i, close);
                i = close + 3;
            } else if (c == '\'' || c == '"') {
                int close = i + 1;
                while (close < text.length() && text.charAt(close) != c) {
                    char q = text.charAt(close);
                    if (q == '\n' || q == '\r') {
                        throw error("Unterminated quoted value in list or table");
                    }
                    close++;
                }
                if (close == text.length()) {
                    throw error("Unterminated quoted value in list or table");
                }
                i = close + 1;
            } else if (c == '#') {
                i = lineContentEnd(i);
            } else {
                i++;
            }
        }
        throw new CifParseException(
                "Unterminated list or table opened at line " + startLine, sourceName, lastGoodOffset, startLine);
    }

    /** Skips a semicolon text field inside a list or table; returns the offset after its closing semicolon. */
    private int skipNestedTextField(int openAt, int compoundLine) {
        int lineEnd = lineContentEnd(openAt);
        while (lineEnd < text.length()) {
            int nextLine = afterTerminator(lineEnd);
            line++;
            if (nextLine < text.length() && text.charAt(nextLine) == ';') {
                return nextLine + 1;
            }
            lineEnd = lineContentEnd(nextLine);
        }
        throw new CifParseException(
                "Unterminated text field in list or table opened at line " + compoundLine,
                sourceName,
                lastGoodOffset,
                compoundLine);
    }

    // ── Words ──

    private Token scanWord() {
        int start = pos;
        while (pos < text.length() && !isWhitespace(text.charAt(pos))) {
            pos++;
        }
        String word = text.substring(start, pos);
        Span span = new Span(start, pos);
        if (word.charAt(0) == '_') {
            onTag();
            return new Token(TokenType.TAG, word, span, line, line);
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.equals("loop_")) {
            state = State.IN_LOOP_HEADER;
            loopColumns = 0;
            valuePending = false;
            return new Token(TokenType.LOOP, word, span, line, line);
        }
        if (lower.startsWith("data_")) {
            if (word.length() == "data_".length()) {
                throw error("data_ header without a block name");
            }
            return keyword(TokenType.BLOCK_HEADER, word, span);
        }
        if (lower.equals("save_")) {
            return keyword(TokenType.SAVE_END, word, span);
        }
        if (lower.startsWith("save_") || lower.equals("global_")) {
            return keyword(TokenType.BLOCK_HEADER, word, span);
        }
        if (lower.equals("stop_")) {
            return keyword(TokenType.STOP, word, span);
        }
        if (lower.startsWith("loop_") || lower.startsWith("global_") || lower.startsWith("stop_")) {
            throw error("Unknown reserved word '" + word + "'");
        }
        onValue();
        return new Token(TokenType.BARE, word, span, line, line);
    }

    private Token keyword(TokenType type, String word, Span span) {
        state = State.TOP_LEVEL;
        valuePending = false;
        return new Token(type, word, span, line, line);
    }

    private void onTag() {
        switch (state) {
            case IN_LOOP_HEADER -> loopColumns++;
            case IN_LOOP_ROW -> {
                state = State.TOP_LEVEL;
                valuePending = true;
            }
            default -> valuePending = true;
        }
    }

    private void onValue() {
        if (state == State.IN_LOOP_HEADER) {
            if (loopColumns == 0) {
                throw error("loop_ declares no columns before its first value");
            }
            state = State.IN_LOOP_ROW;
        } else if (state == State.TOP_LEVEL) {
            valuePending = false;
        }
    }

    // ── Character helpers ──

    private int lineContentEnd(int from) {
        int i = from;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                break;
            }
            i++;
        }
        return i;
    }

    private int afterTerminator(int at) {
        if (at >= text.length()) {
            return at;
        }
        if (text.charAt(at) == '\r' && at + 1 < text.length() && text.charAt(at + 1) == '\n') {
            return at + 2;
        }
        return at + 1;
    }

    private boolean isBlank(int from, int to) {
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }

    private int countLineBreaks(int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            char c = text.charAt(i);
            if (c == '\n' || (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n'))) {
                count++;
            }
        }
        return count;
    }

    private static boolean isWhitespace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    private CifParseException error(String message) {
        return new CifParseException(message, sourceName, lastGoodOffset, line);
    }
}
