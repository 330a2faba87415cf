package io.cifxform.core.model;

import java.util.Objects;

/**
 * A CIF data value. The variants are closed; each keeps enough of its original spelling for the
 * document to be written back unchanged.
 *
 * <p>
 * {@link #text()} is always the unquoted content; for a {@link Compound} it is the bracketed
 * source.
 */
public sealed interface Value {

    /** The unquoted content of the value. */
    String text();

    /** Returns {@code true} for the unquoted CIF placeholders {@code ?} (unknown) and {@code .} (inapplicable). */
    default boolean isPlaceholder() {
        return false;
    }

    /** Renders the value exactly as it appears in a loop row or after a field name. */
    String render();

    /** An unquoted token. */
    record Bare(String text) implements Value {
        public Bare {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public boolean isPlaceholder() {
            return text.equals("?") || text.equals(".");
        }

        @Override
        public String render() {
            return text;
        }
    }

    /**
     * A single-line value delimited by {@code '} or {@code "}.
     *
     * @param quote the delimiter used in the source
     */
    record Quoted(String text, char quote) implements Value {
        public Quoted {
            Objects.requireNonNull(text, "text must not be null");
            if (quote != '\'' && quote != '"') {
                throw new IllegalArgumentException("Unsupported quote character: " + quote);
            }
        }

        @Override
        public String render() {
            return quote + text + quote;
        }
    }

    /**
     * A semicolon-delimited multi-line value. {@code text} keeps the original line wrapping; an empty
     * first line after the opening semicolon is not part of it.
     */
    record TextBlock(String text) implements Value {
        public TextBlock {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String render() {
            return ";\n" + text + "\n;";
        }
    }

    /**
     * A CIF2 list ({@code [...]}) or table ({@code {...}}). Kept verbatim, brackets included; the
     * members are not interpreted.
     */
    record Compound(String text) implements Value {
        public Compound {
            Objects.requireNonNull(text, "text must not be null");
            if (text.isEmpty() || (text.charAt(0) != '[' && text.charAt(0) != '{')) {
                throw new IllegalArgumentException("Not a list or table: " + text);
            }
        }

        @Override
        public String render() {
            return text;
        }
    }

    /**
     * A value delimited by {@code '''} or {@code """}; may span lines.
     *
     * @param quote the character tripled in the delimiter
     */
    record TripleQuoted(String text, char quote) implements Value {
        public TripleQuoted {
            Objects.requireNonNull(text, "text must not be null");
            if (quote != '\'' && quote != '"') {
                throw new IllegalArgumentException("Unsupported quote character: " + quote);
            }
        }

        @Override
        public String render() {
            String delimiter = String.valueOf(quote).repeat(3);
            return delimiter + text + delimiter;
        }
    }
}
