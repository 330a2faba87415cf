package io.cifxform.core.model;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed CIF document. Keeps the exact source text alongside the structure recovered from it,
 * so serializing an unmodified document returns the input unchanged. Every transformation builds a
 * new {@code Document}; none mutates one.
 *
 * <p>
 * Thread-safe and immutable.
 *
 * @param text           the decoded source
 * @param sourceName     where the text came from, for diagnostics
 * @param leading        comments, blank lines and version markers before the first block
 * @param blocks         blocks in document order
 * @param protectedSpans text-block bodies, triple-quoted bodies, CIF2 lists and tables, and comments, in
 *                       document order
 */
public record Document(
        String text, String sourceName, List<Entry> leading, List<Block> blocks, List<ProtectedSpan> protectedSpans) {

    public Document {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourceName, "sourceName must not be null");
        leading = List.copyOf(leading);
        blocks = List.copyOf(blocks);
        protectedSpans = List.copyOf(protectedSpans);
    }

    /** Returns the document text. Identical to the parsed input for an unmodified document. */
    public String serialize() {
        return text;
    }

    /** Returns the document text encoded as UTF-8. */
    public byte[] toBytes() {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /** Returns the first block with this name and any kind. */
    public Optional<Block> block(String name) {
        for (Block block : blocks) {
            if (block.name().equals(name)) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    /** Returns the first {@code data_} block. */
    public Optional<Block> firstDataBlock() {
        for (Block block : blocks) {
            if (block.kind() == Block.Kind.DATA) {
                return Optional.of(block);
            }
        }
        return Optional.empty();
    }

    /** Returns the version marker comment among the leading entries, if any. */
    public Optional<Entry.Comment> versionMarker() {
        for (Entry entry : leading) {
            if (entry instanceof Entry.Comment comment && comment.isVersionMarker()) {
                return Optional.of(comment);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the line break the document uses, taken from its first line: {@code "\r\n"},
     * {@code "\r"}, or {@code "\n"} (also for single-line text).
     */
    public String lineTerminator() {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\n') {
                return "\n";
            }
            if (c == '\r') {
                return i + 1 < text.length() && text.charAt(i + 1) == '\n' ? "\r\n" : "\r";
            }
        }
        return "\n";
    }

    /** Returns the text a span covers. */
    public String slice(Span span) {
        return span.of(text);
    }
}
