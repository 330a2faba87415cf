package io.cifxform.core.model;

import java.util.Objects;

/**
 * One diagnostic produced by a transformation.
 *
 * @param severity how serious the entry is
 * @param code     stable machine-readable identifier, e.g. {@code RENAMED}
 * @param message  human-readable description
 * @param line     1-based source line the entry refers to, or {@code null}
 */
public record ChangeEntry(Severity severity, String code, String message, Integer line) {

    /** Diagnostic levels. */
    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    public ChangeEntry {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        String where = line != null ? " (line " + line + ")" : "";
        return severity + " " + code + ": " + message + where;
    }
}
