package io.cifxform.core.rules;

import io.cifxform.core.error.RuleEvaluationException;
import io.cifxform.core.model.ChangeLog;
import io.cifxform.core.model.Document;
import java.util.List;
import java.util.Objects;

/**
 * Result of applying an ordered rule list.
 *
 * @param document  the document after the last successful rule
 * @param changeLog one entry per rule outcome
 * @param outcomes  outcomes of the rules that ran, the failed one included
 * @param failure   the error that aborted the run, tagged with the rule index, or {@code null}
 */
public record RuleRunResult(
        Document document, ChangeLog changeLog, List<RuleOutcome> outcomes, RuleEvaluationException failure) {

    public RuleRunResult {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(changeLog, "changeLog must not be null");
        outcomes = List.copyOf(outcomes);
    }

    /** Returns {@code true} if a rule failed and the remaining rules were not run. */
    public boolean isAborted() {
        return failure != null;
    }
}
