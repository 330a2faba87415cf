package io.cifxform.core.convert;

import java.util.List;
import java.util.Objects;

/**
 * How one alias conflict in one block was settled.
 *
 * @param block       name of the block holding the conflict
 * @param canonicalId canonical id of the field, or the exact spelling when the dictionaries do not
 *                    know it
 * @param kept        spelling of the surviving occurrence as it was written
 * @param normalized  spelling the survivor carries after resolution
 * @param discarded   spellings of the deleted occurrences, in document order
 * @param tieBreak    the rule that picked the survivor
 */
public record AliasResolution(
        String block, String canonicalId, String kept, String normalized, List<String> discarded, TieBreak tieBreak) {

    /** Tie-break rules, in the order they are tried. */
    public enum TieBreak {
        /** The only occurrence whose value is neither a placeholder nor the declared default. */
        NON_DEFAULT_VALUE,
        /** The only remaining occurrence spelled in the block's dominant notation. */
        DOMINANT_NOTATION,
        /** The first remaining occurrence in document order. */
        FIRST_OCCURRENCE
    }

    public AliasResolution {
        Objects.requireNonNull(block, "block must not be null");
        Objects.requireNonNull(canonicalId, "canonicalId must not be null");
        Objects.requireNonNull(kept, "kept must not be null");
        Objects.requireNonNull(normalized, "normalized must not be null");
        Objects.requireNonNull(tieBreak, "tieBreak must not be null");
        discarded = List.copyOf(discarded);
    }
}
