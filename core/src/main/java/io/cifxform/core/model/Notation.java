package io.cifxform.core.model;

import java.util.Locale;

/**
 * Field-name spelling conventions. {@link #LEGACY} names are underscore-delimited
 * ({@code _cell_length_a}); {@link #MODERN} names separate category and attribute with a dot
 * ({@code _cell.length_a}).
 */
public enum Notation {
    LEGACY,
    MODERN;

    /** Returns the notation a concrete data name is written in. */
    public static Notation of(String dataName) {
        return dataName.indexOf('.') >= 0 ? MODERN : LEGACY;
    }

    /**
     * Parses a configuration value. Accepts the enum names case-insensitively plus the CIF
     * version aliases {@code cif1} and {@code cif2}.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static Notation parse(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "legacy", "cif1" -> LEGACY;
            case "modern", "cif2" -> MODERN;
            default -> throw new IllegalArgumentException(
                    "Unknown notation '" + value + "', expected one of: legacy, modern");
        };
    }
}
