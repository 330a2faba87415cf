package io.cifxform.core.error;

/**
 * Thrown when a dictionary source is structurally invalid, cannot be read, or uses a definition
 * language dialect that is not supported.
 */
public final class DictionaryLoadException extends CifLoadException {

    private static final long serialVersionUID = 1L;

    public DictionaryLoadException(String message, String source) {
        super(message, source);
    }

    public DictionaryLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
