package io.cifxform.core.error;

/**
 * Thrown when a rewrite cannot be applied: overlapping edits, an edit that does not address a span
 * recorded by the parser, or a protected span that would not survive the rewrite. Fatal to the
 * conversion call; the input document is left untouched.
 */
public final class ConversionException extends CifException {

    private static final long serialVersionUID = 1L;

    public ConversionException(String message, String source) {
        super(message, source, Phase.CONVERSION);
    }

    public ConversionException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.CONVERSION);
    }
}
