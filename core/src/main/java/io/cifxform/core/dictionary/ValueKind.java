package io.cifxform.core.dictionary;

import java.util.Locale;

/** Declared content type of a field, reduced to what validation and formatting need. */
public enum ValueKind {
    TEXT,
    CODE,
    REAL,
    INTEGER,
    DATE,
    UNKNOWN;

    /** Maps a DDLm {@code _type.contents} value. */
    public static ValueKind fromDdlm(String contents) {
        if (contents == null) {
            return UNKNOWN;
        }
        return switch (contents.trim().toLowerCase(Locale.ROOT)) {
            case "real", "float" -> REAL;
            case "integer", "count", "index" -> INTEGER;
            case "code", "name", "tag", "uchar", "symop" -> CODE;
            case "text", "word", "char", "uri", "version" -> TEXT;
            case "date", "datetime" -> DATE;
            default -> UNKNOWN;
        };
    }

    /** Maps a DDL1 {@code _type} value. */
    public static ValueKind fromDdl1(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        return switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "numb" -> REAL;
            case "char" -> TEXT;
            default -> UNKNOWN;
        };
    }

    public boolean isNumeric() {
        return this == REAL || this == INTEGER;
    }
}
