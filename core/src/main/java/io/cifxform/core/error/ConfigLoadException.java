package io.cifxform.core.error;

/**
 * Thrown when configuration loading fails: missing file, invalid YAML, or an invalid value. The
 * message is suitable for startup error output.
 */
public final class ConfigLoadException extends CifLoadException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message, String source) {
        super(message, source);
    }

    public ConfigLoadException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
