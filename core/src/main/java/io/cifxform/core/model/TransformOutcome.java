package io.cifxform.core.model;

import java.util.Objects;

/**
 * The new document produced by a transformation and the diagnostics gathered while producing it.
 *
 * @param document  the transformed document; the input itself when nothing changed
 * @param changeLog what was changed, skipped or warned about
 */
public record TransformOutcome(Document document, ChangeLog changeLog) {

    public TransformOutcome {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(changeLog, "changeLog must not be null");
    }
}
