package io.cifxform.core.rewrite;

import io.cifxform.core.model.Value;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Writes new values and entries in CIF syntax: decides between bare, quoted and text-block shape,
 * picks a quote delimiter the value does not contain, and lays out new field lines and loops.
 *
 * <p>
 * Line breaks in the output use the formatter's terminator, so text written into a CRLF document
 * matches the lines around it. Immutable and thread-safe.
 */
public final class ValueFormatter {

    /** Values of new fields start at this 1-based column. */
    public static final int VALUE_COLUMN = 35;

    private static final List<String> RESERVED_PREFIXES = List.of("data_", "save_", "loop_", "global_", "stop_");
    private static final String SPECIAL_START = "_#$;'\"";

    private final String lineTerminator;

    public ValueFormatter() {
        this("\n");
    }

    /** @param lineTerminator {@code "\n"}, {@code "\r\n"} or {@code "\r"} */
    public ValueFormatter(String lineTerminator) {
        Objects.requireNonNull(lineTerminator, "lineTerminator must not be null");
        if (!lineTerminator.equals("\n") && !lineTerminator.equals("\r\n") && !lineTerminator.equals("\r")) {
            throw new IllegalArgumentException("Not a line terminator: " + lineTerminator.replace("\r", "\\r"));
        }
        this.lineTerminator = lineTerminator;
    }

    /** A formatter with the same settings that breaks lines with {@code lineTerminator}. */
    public ValueFormatter withLineTerminator(String lineTerminator) {
        return lineTerminator.equals(this.lineTerminator) ? this : new ValueFormatter(lineTerminator);
    }

    public String lineTerminator() {
        return lineTerminator;
    }

    /** Returns {@code true} if the value spans lines and can only be written as a text block. */
    public boolean needsTextBlock(String value) {
        return value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0;
    }

    /**
     * Renders a value in the shape a new field would get: bare when possible, otherwise quoted,
     * or a text block when it spans lines.
     *
     * @throws IllegalArgumentException if the value cannot be written in any shape
     */
    public String format(String value) {
        if (needsTextBlock(value)) {
            return formatTextBlock(value);
        }
        return needsQuotes(value) ? quote(value, '\'') : value;
    }

    /**
     * Renders a replacement for an existing value, keeping its shape: a text block stays a text
     * block, and a quoted value keeps its delimiter when the new text allows it. The placeholders
     * {@code ?} and {@code .} are always written bare, since quoting them turns them into text.
     *
     * @throws IllegalArgumentException if the value cannot be written in any shape
     */
    public String formatLike(String value, Value existing) {
        if (value.equals("?") || value.equals(".")) {
            return value;
        }
        if (existing instanceof Value.TextBlock || needsTextBlock(value)) {
            return formatTextBlock(value);
        }
        if (existing instanceof Value.Quoted quoted) {
            return quote(value, quoted.quote());
        }
        if (existing instanceof Value.TripleQuoted tripleQuoted) {
            String delimiter = String.valueOf(tripleQuoted.quote()).repeat(3);
            if (canTripleQuote(value, tripleQuoted.quote())) {
                return delimiter + value + delimiter;
            }
            return quote(value, '\'');
        }
        return format(value);
    }

    /**
     * Renders a text block: opening semicolon line, content, closing semicolon line.
     *
     * @throws IllegalArgumentException if a content line starts with a semicolon, which would
     *                                  close the block early
     */
    public String formatTextBlock(String value) {
        String normalized = value.replace("\r\n", "\n").replace('\r', '\n');
        for (String line : normalized.split("\n", -1)) {
            if (line.startsWith(";")) {
                throw new IllegalArgumentException("Text block line may not start with ';': " + line);
            }
        }
        String content = lineTerminator.equals("\n") ? normalized : normalized.replace("\n", lineTerminator);
        return ";" + lineTerminator + content + lineTerminator + ";";
    }

    /**
     * Lays out a new field: the name padded so the value starts at {@link #VALUE_COLUMN}, or a
     * text block on the following lines. The result ends with a line break.
     */
    public String fieldLine(String name, String rendered) {
        if (rendered.startsWith(";")) {
            return name + lineTerminator + rendered + lineTerminator;
        }
        int width = VALUE_COLUMN - 1;
        if (name.length() >= width) {
            return name + " " + rendered + lineTerminator;
        }
        return name + " ".repeat(width - name.length()) + rendered + lineTerminator;
    }

    /** Lays out a complete loop, one row per line. The result ends with a line break. */
    public String loop(List<String> columns, List<List<Value>> rows) {
        StringBuilder sb = new StringBuilder("loop_").append(lineTerminator);
        for (String column : columns) {
            sb.append(column).append(lineTerminator);
        }
        for (List<Value> row : rows) {
            StringBuilder line = new StringBuilder();
            for (Value value : row) {
                String rendered = value.render();
                if (value instanceof Value.TextBlock) {
                    if (line.length() > 0) {
                        sb.append(line).append(lineTerminator);
                        line.setLength(0);
                    }
                    sb.append(rendered).append(lineTerminator);
                } else {
                    if (line.length() > 0) {
                        line.append(' ');
                    }
                    line.append(rendered);
                }
            }
            if (line.length() > 0) {
                sb.append(line).append(lineTerminator);
            }
        }
        return sb.toString();
    }

    boolean needsQuotes(String value) {
        if (value.isEmpty()) {
            return true;
        }
        if (value.equals("?") || value.equals(".")) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isWhitespace(c) || "[]{}'\"".indexOf(c) >= 0) {
                return true;
            }
        }
        if (SPECIAL_START.indexOf(value.charAt(0)) >= 0) {
            return true;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        for (String reserved : RESERVED_PREFIXES) {
            if (lower.startsWith(reserved)) {
                return true;
            }
        }
        return false;
    }

    private String quote(String value, char preferred) {
        char other = preferred == '\'' ? '"' : '\'';
        for (char quote : new char[] {preferred, other}) {
            if (value.indexOf(quote) < 0) {
                return quote + value + quote;
            }
        }
        for (char quote : new char[] {'\'', '"'}) {
            if (canTripleQuote(value, quote)) {
                String delimiter = String.valueOf(quote).repeat(3);
                return delimiter + value + delimiter;
            }
        }
        throw new IllegalArgumentException("Value cannot be quoted with any delimiter: " + value);
    }

    private static boolean canTripleQuote(String value, char quote) {
        String delimiter = String.valueOf(quote).repeat(3);
        return !value.contains(delimiter) && (value.isEmpty() || value.charAt(value.length() - 1) != quote);
    }
}
