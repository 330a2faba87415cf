package io.cifxform.core.dictionary;

import io.cifxform.core.model.ChangeLog;
import java.util.Objects;

/**
 * Outcome of loading several dictionary sources at once.
 *
 * @param set       the merged set of every source that loaded; empty if none did
 * @param changeLog one warning per skipped source, plus the merged set's own warnings
 */
public record DictionaryLoadResult(DictionarySet set, ChangeLog changeLog) {

    public DictionaryLoadResult {
        Objects.requireNonNull(set, "set must not be null");
        Objects.requireNonNull(changeLog, "changeLog must not be null");
    }
}
