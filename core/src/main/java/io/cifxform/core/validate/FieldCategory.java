package io.cifxform.core.validate;

/** Classification of one data name against the loaded dictionaries. */
public enum FieldCategory {
    /** Defined by a dictionary and current. */
    VALID,
    /** Defined, but through a deprecated alias or a superseded definition. */
    DEPRECATED,
    /** Not defined, but carries a registered local prefix such as {@code _shelx_}. */
    REGISTERED_LOCAL,
    /** Not defined, but on the user's allow-list. */
    USER_ALLOWED,
    /** None of the above. */
    UNKNOWN
}
