package io.cifxform.core.dictionary;

/**
 * A spelling claimed by two definitions while building a {@link DictionarySet}.
 *
 * @param spelling        the contested data name
 * @param keptId          canonical id the spelling now resolves to
 * @param discardedId     canonical id that lost the spelling
 * @param keptSource      source of the winning definition
 * @param discardedSource source of the losing definition
 * @param kind            how the conflict was decided
 */
public record MergeConflict(
        String spelling, String keptId, String discardedId, String keptSource, String discardedSource, Kind kind) {

    /** How a conflict was decided. */
    public enum Kind {
        /** A higher-precedence source took the spelling over. */
        OVERRIDE,
        /** Two definitions of the same precedence claimed it; the first one kept it. */
        TIE
    }

    @Override
    public String toString() {
        return kind + " " + spelling + ": " + keptId + " (" + keptSource + ") over " + discardedId + " ("
                + discardedSource + ")";
    }
}
