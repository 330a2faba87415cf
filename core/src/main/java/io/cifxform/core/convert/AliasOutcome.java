package io.cifxform.core.convert;

import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.model.Document;
import java.util.List;
import java.util.Objects;

/**
 * Result of {@link AliasResolver#resolveAliases}.
 *
 * @param document    the document with every conflict settled
 * @param changeLog   one entry per resolution
 * @param resolutions the resolutions, block by block in document order
 */
public record AliasOutcome(Document document, ChangeLog changeLog, List<AliasResolution> resolutions) {

    public AliasOutcome {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(changeLog, "changeLog must not be null");
        resolutions = List.copyOf(resolutions);
    }
}
