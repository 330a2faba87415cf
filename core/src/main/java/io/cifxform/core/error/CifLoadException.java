package io.cifxform.core.error;

/**
 * Abstract parent for errors raised while loading a definition source: a dictionary, a rule file
 * or a configuration file. Failing one source never poisons the others.
 */
public abstract class CifLoadException extends CifException {

    private static final long serialVersionUID = 1L;

    protected CifLoadException(String message, String source) {
        super(message, source, Phase.LOAD);
    }

    protected CifLoadException(String message, Throwable cause, String source) {
        super(message, cause, source, Phase.LOAD);
    }
}
