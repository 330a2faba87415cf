package io.cifxform.core.convert;

/** Which notation a whole document is written in. */
public enum CifVersion {
    LEGACY,
    MODERN,
    MIXED,
    UNKNOWN
}
