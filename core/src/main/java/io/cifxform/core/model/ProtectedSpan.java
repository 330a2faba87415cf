package io.cifxform.core.model;

import java.util.Objects;

/**
 * A range of the source that must be copied verbatim by every rewrite and never scanned for
 * field names.
 *
 * @param span the protected characters
 * @param kind what the range holds
 */
public record ProtectedSpan(Span span, Kind kind) {

    /** The construct a protected span belongs to. */
    public enum Kind {
        TEXT_BLOCK,
        TRIPLE_QUOTED,
        /** A CIF2 list or table. */
        COMPOUND,
        COMMENT
    }

    public ProtectedSpan {
        Objects.requireNonNull(span, "span must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
