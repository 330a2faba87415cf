package io.cifxform.core.error;

/**
 * Abstract base for all cif-xform exceptions. Never thrown directly. Use the concrete subclasses
 * under {@link CifLoadException}, or {@link CifParseException}, {@link ConversionException} and
 * {@link RuleEvaluationException}.
 */
public abstract class CifException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        PARSE,
        LOAD,
        CONVERSION,
        EVALUATION
    }

    private final String source;
    private final Phase phase;

    protected CifException(String message, String source, Phase phase) {
        super(message);
        this.source = source;
        this.phase = phase;
    }

    protected CifException(String message, Throwable cause, String source, Phase phase) {
        super(message, cause);
        this.source = source;
        this.phase = phase;
    }

    /** The document, dictionary or rule file that triggered the error, or {@code null} if unknown. */
    public String source() {
        return source;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
