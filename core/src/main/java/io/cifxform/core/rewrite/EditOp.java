package io.cifxform.core.rewrite;

import io.cifxform.core.model.Span;
import java.util.Objects;

/**
 * One span-addressed edit. The target is always a span the parser recorded for the op's
 * {@link Kind}; the {@link RewriteEngine} rejects anything else.
 *
 * @param kind        what the target span must be
 * @param target      the characters replaced; zero-width for {@link Kind#INSERT}
 * @param replacement the new text
 */
public record EditOp(Kind kind, Span target, String replacement) {

    /** Edit kinds and the recorded span each one must target. */
    public enum Kind {
        /** Target is a field-name or loop-column name span. */
        RENAME,
        /** Target is a value span. */
        REPLACE_VALUE,
        /** Target is an entry extent; replacement is empty. */
        DELETE_ENTRY,
        /** Target is an entry extent. */
        REPLACE_ENTRY,
        /** Target is a zero-width span at an entry boundary. */
        INSERT
    }

    public EditOp {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (kind == Kind.INSERT && !target.isEmpty()) {
            throw new IllegalArgumentException("INSERT target must be zero-width, got " + target);
        }
        if (kind == Kind.DELETE_ENTRY && !replacement.isEmpty()) {
            throw new IllegalArgumentException("DELETE_ENTRY carries no replacement");
        }
    }

    public static EditOp rename(Span nameSpan, String newName) {
        return new EditOp(Kind.RENAME, nameSpan, newName);
    }

    public static EditOp replaceValue(Span valueSpan, String rendered) {
        return new EditOp(Kind.REPLACE_VALUE, valueSpan, rendered);
    }

    public static EditOp deleteEntry(Span extent) {
        return new EditOp(Kind.DELETE_ENTRY, extent, "");
    }

    public static EditOp replaceEntry(Span extent, String text) {
        return new EditOp(Kind.REPLACE_ENTRY, extent, text);
    }

    public static EditOp insert(int offset, String text) {
        return new EditOp(Kind.INSERT, Span.at(offset), text);
    }
}
