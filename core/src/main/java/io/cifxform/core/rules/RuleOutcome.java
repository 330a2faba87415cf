package io.cifxform.core.rules;

import java.util.Objects;

/**
 * What one rule did.
 *
 * @param index  zero-based position of the rule in the run
 * @param rule   the rule
 * @param status the result
 * @param detail human-readable explanation
 * @param value  the value found by CHECK, or written by EDIT, CALCULATE and APPEND; otherwise
 *               {@code null}
 */
public record RuleOutcome(int index, Rule rule, Status status, String detail, String value) {

    /** Rule results. The first four are reported by CHECK only. */
    public enum Status {
        MISSING,
        MATCHES_DEFAULT,
        DIFFERS_FROM_DEFAULT,
        IN_LOOP,
        APPLIED,
        CREATED,
        SKIPPED,
        FAILED
    }

    public RuleOutcome {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(detail, "detail must not be null");
    }
}
