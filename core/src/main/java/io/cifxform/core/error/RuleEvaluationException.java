package io.cifxform.core.error;

/**
 * Thrown when a single rule cannot be evaluated: a missing or non-numeric operand, division by
 * zero, or a value that cannot be written back. Carries the failing field and, once the rule
 * engine has caught it, the index of the rule in its list.
 */
public final class RuleEvaluationException extends CifException {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final Integer ruleIndex;

    public RuleEvaluationException(String message, String field) {
        this(message, field, null, null);
    }

    public RuleEvaluationException(String message, String field, String source, Integer ruleIndex) {
        super(message, source, Phase.EVALUATION);
        this.field = field;
        this.ruleIndex = ruleIndex;
    }

    /** The field the failing rule was evaluating, or referencing when the operand was at fault. */
    public String field() {
        return field;
    }

    /** Zero-based position of the failing rule in the run, or {@code null} outside a run. */
    public Integer ruleIndex() {
        return ruleIndex;
    }

    /** Returns a copy of this exception tagged with the rule position and rule source. */
    public RuleEvaluationException atRule(int index, String ruleSource) {
        RuleEvaluationException tagged = new RuleEvaluationException(getMessage(), field, ruleSource, index);
        tagged.setStackTrace(getStackTrace());
        return tagged;
    }
}
