package io.cifxform.core.error;

/**
 * Thrown when CIF text is structurally malformed: an unterminated text block or quote, a loop row
 * whose value count does not match its columns, an unknown header token. Always fatal to the parse
 * call; no partial document is produced.
 */
public final class CifParseException extends CifException {

    private static final long serialVersionUID = 1L;

    private final int lastGoodOffset;
    private final int line;

    public CifParseException(String message, String source, int lastGoodOffset, int line) {
        super(message + " (line " + line + ")", source, Phase.PARSE);
        this.lastGoodOffset = lastGoodOffset;
        this.line = line;
    }

    public CifParseException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.PARSE);
        this.lastGoodOffset = 0;
        this.line = 0;
    }

    /** Offset just past the last token that was lexed and parsed successfully. */
    public int lastGoodOffset() {
        return lastGoodOffset;
    }

    /** 1-based line of the offending input, or 0 when the input could not be decoded at all. */
    public int line() {
        return line;
    }
}
