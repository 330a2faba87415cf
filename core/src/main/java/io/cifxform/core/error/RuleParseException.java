package io.cifxform.core.error;

/** Thrown when a field-rule source contains a line that is not a valid rule. */
public final class RuleParseException extends CifLoadException {

    private static final long serialVersionUID = 1L;

    private final int line;

    public RuleParseException(String message, String source, int line) {
        super(message + " (line " + line + ")", source);
        this.line = line;
    }

    public RuleParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
        this.line = 0;
    }

    /** 1-based line number, or 0 if the source could not be read. */
    public int line() {
        return line;
    }
}
