package io.cifxform.core.validate;

import io.cifxform.core.model.ChangeLog;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Result of {@link DocumentValidator#validate}.
 *
 * @param checks   one check per data name occurrence, in document order
 * @param problems warnings for deprecated and unknown names and for values that violate their
 *                 declared type or enumeration
 */
public record ValidationReport(List<DataNameCheck> checks, ChangeLog problems) {

    public ValidationReport {
        checks = List.copyOf(checks);
        Objects.requireNonNull(problems, "problems must not be null");
    }

    public List<DataNameCheck> checks(FieldCategory category) {
        List<DataNameCheck> matches = new ArrayList<>();
        for (DataNameCheck check : checks) {
            if (check.category() == category) {
                matches.add(check);
            }
        }
        return matches;
    }

    /** Distinct dictionary files suggested for local and unknown names, in first-seen order. */
    public List<String> suggestedDictionaries() {
        Set<String> suggested = new LinkedHashSet<>();
        for (DataNameCheck check : checks) {
            if (check.suggestedDictionary() != null) {
                suggested.add(check.suggestedDictionary());
            }
        }
        return List.copyOf(suggested);
    }

    /** Returns {@code true} if no problem was found. */
    public boolean isClean() {
        return problems.isEmpty();
    }
}
